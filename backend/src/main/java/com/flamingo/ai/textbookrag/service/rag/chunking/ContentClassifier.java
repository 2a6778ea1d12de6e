package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.EquationData;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects the kind of academic content in a piece of text and measures how much of it is
 * mathematics.
 */
@Component
public class ContentClassifier {

  private static final List<String> LATEX_COMMANDS =
      List.of(
          "int", "sum", "prod", "lim", "frac", "sqrt", "partial", "nabla", "infty", "alpha", "beta",
          "gamma", "delta", "theta", "lambda", "mu", "sigma", "pi", "omega", "sin", "cos", "tan",
          "log", "ln", "exp", "det", "dim", "ker", "max", "min");

  private static final Pattern LATEX_PATTERN =
      Pattern.compile("\\\\(?:" + String.join("|", LATEX_COMMANDS) + ")");

  private static final Pattern SYMBOL_PATTERN =
      Pattern.compile("[∫∑∏√∞∂∇αβγδθλμσπω≤≥≠≈∈∉⊂⊃∪∩×÷±∓→←↔⇒⇐⇔]");

  private static final Pattern DISPLAY_DOLLAR =
      Pattern.compile("\\$\\$(.*?)\\$\\$", Pattern.DOTALL);
  private static final Pattern DISPLAY_BRACKET =
      Pattern.compile("\\\\\\[(.*?)\\\\]", Pattern.DOTALL);
  private static final Pattern INLINE_DOLLAR =
      Pattern.compile("(?<!\\$)\\$(?!\\$)([^$\\n]+?)\\$(?!\\$)");
  private static final Pattern INLINE_PAREN = Pattern.compile("\\\\\\((.*?)\\\\\\)");

  private static final Pattern DEFINITION =
      Pattern.compile("\\bdefinition\\b|\\bdefine\\b|\\bdef\\.");
  private static final Pattern THEOREM =
      Pattern.compile("\\btheorem\\b|\\bthm\\.|\\blemma\\b|\\bcorollary\\b");
  private static final Pattern PROOF =
      Pattern.compile(
          "\\bproof\\b|\\bprove\\b|\\bq\\.e\\.d\\b|∎|\\btherefore\\b|\\bhence\\b|\\bthus\\b"
              + "|\\blet us prove\\b|\\bwe shall prove\\b|\\bsolution\\b");
  private static final Pattern DERIVATION =
      Pattern.compile(
          "\\bderive\\b|\\bderivation\\b|\\bderivative\\b|\\bstep \\d+\\b|\\bfrom.*we get\\b"
              + "|\\bsubstituting\\b|\\bsolving\\b|\\bsimplifying\\b");
  private static final Pattern EXAMPLE = Pattern.compile("\\bexample\\b|\\bex\\.");
  private static final Pattern EXERCISE =
      Pattern.compile("\\bexercise\\b|\\bquestion\\b|\\bq\\.|\\bproblem\\b");
  private static final Pattern SOLUTION =
      Pattern.compile("\\bsolution\\b|\\bsol\\.|\\banswer\\b");

  /** Math density at or above which otherwise plain text counts as a formula. */
  static final double FORMULA_DENSITY = 0.4;

  /**
   * Classifies text by the first matching family, in the order definition, theorem, proof,
   * derivation, example, exercise, solution; otherwise formula for math-dense text, else text.
   */
  public ContentType detect(String text) {
    if (text == null || text.isBlank()) {
      return ContentType.TEXT;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (DEFINITION.matcher(lower).find()) {
      return ContentType.DEFINITION;
    }
    if (THEOREM.matcher(lower).find()) {
      return ContentType.THEOREM;
    }
    if (PROOF.matcher(lower).find()) {
      return ContentType.PROOF;
    }
    if (DERIVATION.matcher(lower).find() || countEquals(text) >= 3) {
      return ContentType.DERIVATION;
    }
    if (EXAMPLE.matcher(lower).find()) {
      return ContentType.EXAMPLE;
    }
    if (EXERCISE.matcher(lower).find()) {
      return ContentType.EXERCISE;
    }
    if (SOLUTION.matcher(lower).find()) {
      return ContentType.SOLUTION;
    }
    if (mathDensity(text) >= FORMULA_DENSITY) {
      return ContentType.FORMULA;
    }
    return ContentType.TEXT;
  }

  /** Display equations first, then inline ones; ids are assigned in that order. */
  public List<EquationData> extractEquations(String text) {
    List<EquationData> equations = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return equations;
    }
    collect(DISPLAY_DOLLAR, text, false, equations);
    collect(DISPLAY_BRACKET, text, false, equations);
    collect(INLINE_DOLLAR, text, true, equations);
    collect(INLINE_PAREN, text, true, equations);
    return equations;
  }

  /**
   * Share of mathematical characters, capped at 1. LaTeX commands weigh 5, symbols 2, and every
   * delimited equation body counts its length.
   */
  public double mathDensity(String text) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }
    int mathChars = count(LATEX_PATTERN, text) * 5 + count(SYMBOL_PATTERN, text) * 2;
    for (EquationData equation : extractEquations(text)) {
      mathChars += equation.latex().length();
    }
    return Math.min((double) mathChars / text.length(), 1.0);
  }

  private static void collect(
      Pattern pattern, String text, boolean inline, List<EquationData> out) {
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      String body = m.group(1);
      out.add(
          new EquationData(
              "eq_" + (out.size() + 1),
              body.strip(),
              m.group(),
              inline,
              !inline && (body.contains("\n") || body.contains("\\\\"))));
    }
  }

  private static int count(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    int n = 0;
    while (m.find()) {
      n++;
    }
    return n;
  }

  private static int countEquals(String text) {
    int n = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '=') {
        n++;
      }
    }
    return n;
  }
}
