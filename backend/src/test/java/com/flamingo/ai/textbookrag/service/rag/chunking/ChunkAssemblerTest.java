package com.flamingo.ai.textbookrag.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.CollectionKind;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkAssembler Tests")
class ChunkAssemblerTest {

  private static final StructuralContext CONTEXT =
      new StructuralContext(3, "Matrices", "3.1 INTRODUCTION");

  private RagConfig ragConfig;
  private ChunkAssembler assembler;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    assembler = new ChunkAssembler(ragConfig, new ContentClassifier());
  }

  private static String paragraph(char letter, int length) {
    return String.valueOf(letter).repeat(length);
  }

  @Nested
  @DisplayName("splitBySize()")
  class SplitBySize {

    @Test
    @DisplayName("should keep every part within the limit and preserve paragraph order")
    void shouldKeepPartsWithinLimit_andPreserveOrder() {
      String text =
          String.join(
              "\n\n",
              paragraph('a', 60),
              paragraph('b', 60),
              paragraph('c', 60),
              paragraph('d', 60));

      List<String> parts = ChunkAssembler.splitBySize(text, 130);

      assertThat(parts).hasSize(2);
      assertThat(parts).allSatisfy(p -> assertThat(p.length()).isLessThanOrEqualTo(130));
      assertThat(String.join("\n\n", parts)).isEqualTo(text);
    }

    @Test
    @DisplayName("should split an oversized paragraph at sentence boundaries")
    void shouldSplitOversizedParagraph_atSentences() {
      String text = "First sentence here. Second sentence here. Third sentence here.";

      List<String> parts = ChunkAssembler.splitBySize(text, 25);

      assertThat(parts)
          .containsExactly(
              "First sentence here.", "Second sentence here.", "Third sentence here.");
    }

    @Test
    @DisplayName("should cut a sentence longer than the limit")
    void shouldCutSentence_longerThanLimit() {
      List<String> parts = ChunkAssembler.splitBySize(paragraph('x', 25), 10);

      assertThat(parts).extracting(String::length).containsExactly(10, 10, 5);
    }

    @Test
    @DisplayName("should return no parts for blank text")
    void shouldReturnNoParts_forBlankText() {
      assertThat(ChunkAssembler.splitBySize("  \n\n  ", 100)).isEmpty();
    }
  }

  @Nested
  @DisplayName("assembleCollection()")
  class AssembleCollection {

    @Test
    @DisplayName("should emit one draft when the body fits")
    void shouldEmitSingleDraft_whenBodyFits() {
      OpenCollection collection =
          new OpenCollection(CollectionKind.EXERCISE, "3.1", 5, CONTEXT);
      collection.append("EXERCISE 3.1\n1. Solve x.", PageRecord.ofText(5, ""), 0);

      List<ChunkDraft> drafts = assembler.assembleCollection(collection, "doc", "12");

      assertThat(drafts).hasSize(1);
      ChunkDraft draft = drafts.get(0);
      assertThat(draft.getContentType()).isEqualTo(ContentType.EXERCISE);
      assertThat(draft.getExerciseNumber()).isEqualTo("3.1");
      assertThat(draft.getExampleNumber()).isNull();
      assertThat(draft.getPartNumber()).isEqualTo(1);
      assertThat(draft.getTotalParts()).isEqualTo(1);
      assertThat(draft.getContext()).isEqualTo(CONTEXT);
      assertThat(draft.getText()).isEqualTo("EXERCISE 3.1\n1. Solve x.");
    }

    @Test
    @DisplayName("should split long body into labelled parts within the size limit")
    void shouldSplitLongBody_intoLabelledParts() {
      ragConfig.getChunking().setMaxChunkSize(200);
      OpenCollection collection = new OpenCollection(CollectionKind.EXAMPLE, "4", 2, CONTEXT);
      collection.append(
          String.join("\n\n", paragraph('a', 120), paragraph('b', 120), paragraph('c', 120)),
          PageRecord.ofText(2, ""),
          0);
      collection.append(paragraph('d', 120), PageRecord.ofText(3, ""), 0);

      List<ChunkDraft> drafts = assembler.assembleCollection(collection, "doc", "12");

      assertThat(drafts).hasSize(4);
      assertThat(drafts).allSatisfy(d -> {
        assertThat(d.getText().length()).isLessThanOrEqualTo(200);
        assertThat(d.getExampleNumber()).isEqualTo("4");
        assertThat(d.getTotalParts()).isEqualTo(4);
        assertThat(d.getPageNumbers()).containsExactly(2, 3);
      });
      assertThat(drafts.get(0).getText()).isEqualTo(paragraph('a', 120));
      assertThat(drafts.get(1).getText()).startsWith("Example 4 (Part 2)\n\n");
      assertThat(drafts.get(3).getText()).startsWith("Example 4 (Part 4)");
      assertThat(drafts.get(3).getPageNumber()).isEqualTo(3);
      assertThat(drafts).extracting(ChunkDraft::getPartNumber).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("should keep header and text within a small limit past nine parts")
    void shouldKeepHeaderAndText_withinSmallLimit() {
      ragConfig.getChunking().setMaxChunkSize(60);
      OpenCollection collection = new OpenCollection(CollectionKind.EXERCISE, "3.1", 1, CONTEXT);
      List<String> body = new ArrayList<>();
      for (int i = 0; i < 12; i++) {
        body.add(paragraph((char) ('a' + i), 30));
      }
      collection.append(String.join("\n\n", body), PageRecord.ofText(1, ""), 0);

      List<ChunkDraft> drafts = assembler.assembleCollection(collection, "doc", "12");

      assertThat(drafts).hasSize(12);
      assertThat(drafts).allSatisfy(d -> assertThat(d.getText().length()).isLessThanOrEqualTo(60));
      assertThat(drafts.get(11).getText()).startsWith("Exercise 3.1 (Part 12)\n\n");
    }

    @Test
    @DisplayName("should reject a limit too small for the continuation header")
    void shouldReject_limitTooSmallForHeader() {
      ragConfig.getChunking().setMaxChunkSize(40);
      OpenCollection collection = new OpenCollection(CollectionKind.EXERCISE, "3.1", 1, CONTEXT);
      collection.append(
          String.join("\n\n", paragraph('a', 30), paragraph('b', 30)), PageRecord.ofText(1, ""), 0);

      assertThatThrownBy(() -> assembler.assembleCollection(collection, "doc", "12"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("max-chunk-size 40")
          .hasMessageContaining("Exercise 3.1 (Part 9)");
    }

    @Test
    @DisplayName("should emit nothing for an empty body")
    void shouldEmitNothing_forEmptyBody() {
      OpenCollection collection =
          new OpenCollection(CollectionKind.MISCELLANEOUS, null, 1, CONTEXT);

      assertThat(assembler.assembleCollection(collection, "doc", "12")).isEmpty();
    }
  }

  @Nested
  @DisplayName("assembleStandalone()")
  class AssembleStandalone {

    @Test
    @DisplayName("should respect the token budget")
    void shouldRespectTokenBudget() {
      ragConfig.getChunking().setMaxTokens(20);
      String text =
          String.join(
              "\n\n", paragraph('a', 50), paragraph('b', 50), paragraph('c', 50), "Tail.");

      List<ChunkDraft> drafts = assembler.assembleStandalone(text, CONTEXT, 7, 0, "doc", "12");

      assertThat(drafts).hasSizeGreaterThan(1);
      assertThat(drafts)
          .extracting(d -> ChunkAssembler.estimateTokens(d.getText()))
          .allMatch(tokens -> tokens <= 20);
      assertThat(drafts).allSatisfy(d -> assertThat(d.getPageNumbers()).containsExactly(7));
    }

    @Test
    @DisplayName("should classify each part from its own text")
    void shouldClassifyEachPart() {
      List<ChunkDraft> drafts =
          assembler.assembleStandalone(
              "Definition: a matrix is a rectangular array.", CONTEXT, 1, 0, "doc", "12");

      assertThat(drafts)
          .singleElement()
          .extracting(ChunkDraft::getContentType)
          .isEqualTo(ContentType.DEFINITION);
    }
  }

  @Test
  @DisplayName("freeze should fill equations and size metrics")
  void freezeShouldFillEquationsAndMetrics() {
    ChunkDraft draft =
        ChunkDraft.builder()
            .documentId("doc")
            .classLevel("12")
            .context(CONTEXT)
            .contentType(ContentType.FORMULA)
            .pageNumber(4)
            .text("Area is $\\pi r^2$ exactly.")
            .build();

    Chunk chunk = assembler.freeze(draft);

    assertThat(chunk.chunkId()).isNotBlank();
    assertThat(chunk.pageNumbers()).containsExactly(4);
    assertThat(chunk.equations()).hasSize(1);
    assertThat(chunk.charCount()).isEqualTo(draft.getText().length());
    assertThat(chunk.tokenCount()).isEqualTo(draft.getText().length() / 4);
    assertThat(chunk.mathDensity()).isGreaterThan(0.0);
  }
}
