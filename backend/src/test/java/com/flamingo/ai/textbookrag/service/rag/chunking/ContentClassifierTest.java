package com.flamingo.ai.textbookrag.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.EquationData;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContentClassifier Tests")
class ContentClassifierTest {

  private final ContentClassifier classifier = new ContentClassifier();

  @Nested
  @DisplayName("detect()")
  class Detect {

    @Test
    @DisplayName("should detect definition")
    void shouldDetectDefinition() {
      assertThat(classifier.detect("Definition: a group is a set with an operation."))
          .isEqualTo(ContentType.DEFINITION);
    }

    @Test
    @DisplayName("should detect theorem")
    void shouldDetectTheorem() {
      assertThat(classifier.detect("Theorem 4 says a bounded sequence has a limit point."))
          .isEqualTo(ContentType.THEOREM);
    }

    @Test
    @DisplayName("should detect proof")
    void shouldDetectProof() {
      assertThat(classifier.detect("Proof. Assume the contrary.")).isEqualTo(ContentType.PROOF);
    }

    @Test
    @DisplayName("should detect derivation")
    void shouldDetectDerivation() {
      assertThat(classifier.detect("Substituting the value into the expression."))
          .isEqualTo(ContentType.DERIVATION);
    }

    @Test
    @DisplayName("should detect example")
    void shouldDetectExample() {
      assertThat(classifier.detect("In this example we compute the area."))
          .isEqualTo(ContentType.EXAMPLE);
    }

    @Test
    @DisplayName("should detect exercise")
    void shouldDetectExercise() {
      assertThat(classifier.detect("Answer each question below.")).isEqualTo(ContentType.EXERCISE);
    }

    @Test
    @DisplayName("should detect solution")
    void shouldDetectSolution() {
      assertThat(classifier.detect("Answer: 42")).isEqualTo(ContentType.SOLUTION);
    }

    @Test
    @DisplayName("should detect plain text")
    void shouldDetectPlainText() {
      assertThat(classifier.detect("The river flows through the valley."))
          .isEqualTo(ContentType.TEXT);
    }

    @Test
    @DisplayName("should treat three equals signs as derivation")
    void shouldDetectDerivation_whenThreeEqualsSigns() {
      assertThat(classifier.detect("a = b = c = d")).isEqualTo(ContentType.DERIVATION);
    }

    @Test
    @DisplayName("should prefer definition over theorem when both appear")
    void shouldPreferDefinition_overTheorem() {
      assertThat(classifier.detect("We define a theorem as a proven statement."))
          .isEqualTo(ContentType.DEFINITION);
    }

    @Test
    @DisplayName("should classify math-dense text as formula")
    void shouldClassifyFormula_whenMathDense() {
      assertThat(classifier.detect("$\\frac{a}{b}$")).isEqualTo(ContentType.FORMULA);
    }

    @Test
    @DisplayName("should classify blank text as text")
    void shouldClassifyBlankAsText() {
      assertThat(classifier.detect("  ")).isEqualTo(ContentType.TEXT);
      assertThat(classifier.detect(null)).isEqualTo(ContentType.TEXT);
    }
  }

  @Nested
  @DisplayName("extractEquations()")
  class ExtractEquations {

    @Test
    @DisplayName("should list display equations before inline ones")
    void shouldListDisplayBeforeInline() {
      List<EquationData> equations =
          classifier.extractEquations("Area $x+1$ is $$A = \\pi r^2$$ here.");

      assertThat(equations).hasSize(2);
      assertThat(equations.get(0).equationId()).isEqualTo("eq_1");
      assertThat(equations.get(0).latex()).isEqualTo("A = \\pi r^2");
      assertThat(equations.get(0).inline()).isFalse();
      assertThat(equations.get(1).equationId()).isEqualTo("eq_2");
      assertThat(equations.get(1).latex()).isEqualTo("x+1");
      assertThat(equations.get(1).inline()).isTrue();
    }

    @Test
    @DisplayName("should recognise bracket delimiters")
    void shouldRecogniseBracketDelimiters() {
      List<EquationData> equations =
          classifier.extractEquations("\\[ y = mx + c \\] and \\( a^2 \\)");

      assertThat(equations).extracting(EquationData::latex).containsExactly("y = mx + c", "a^2");
    }

    @Test
    @DisplayName("should mark display equation with line breaks as multiline")
    void shouldMarkMultiline() {
      List<EquationData> equations = classifier.extractEquations("$$a = b \\\\ c = d$$");

      assertThat(equations).singleElement().extracting(EquationData::multiline).isEqualTo(true);
    }
  }

  @Nested
  @DisplayName("mathDensity()")
  class MathDensity {

    @Test
    @DisplayName("should be zero for prose")
    void shouldBeZero_forProse() {
      assertThat(classifier.mathDensity("Plain words only.")).isZero();
      assertThat(classifier.mathDensity("")).isZero();
    }

    @Test
    @DisplayName("should stay within unit interval")
    void shouldStayWithinUnitInterval() {
      double density = classifier.mathDensity("$$\\int \\sum \\frac{1}{2}$$");

      assertThat(density).isBetween(0.0, 1.0);
      assertThat(density).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count symbols")
    void shouldCountSymbols() {
      assertThat(classifier.mathDensity("x ≤ y and y ≥ z")).isGreaterThan(0.0);
    }
  }
}
