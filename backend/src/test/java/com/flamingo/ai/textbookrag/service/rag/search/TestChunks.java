package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.List;
import java.util.Locale;

/** Chunk fixtures and a word-count embedder for search tests. */
final class TestChunks {

  private static final List<String> VOCABULARY =
      List.of(
          "example", "derivative", "limit", "integral", "definition", "matrix", "value", "sum");

  private TestChunks() {}

  static Chunk chunk(String id, ContentType type, String text) {
    return Chunk.builder()
        .chunkId(id)
        .documentId("maths-12")
        .classLevel("12")
        .context(new StructuralContext(1, "Calculus", ""))
        .contentType(type)
        .pageNumber(1)
        .text(text)
        .partNumber(1)
        .totalParts(1)
        .build();
  }

  static Chunk example(String id, String number, String text) {
    return chunk(id, ContentType.EXAMPLE, text).toBuilder().exampleNumber(number).build();
  }

  /** One dimension per vocabulary word plus a constant, so no vector is zero. */
  static EmbeddingProvider wordCountEmbedder() {
    return text -> {
      String lower = text.toLowerCase(Locale.ROOT);
      float[] vector = new float[VOCABULARY.size() + 1];
      for (int i = 0; i < VOCABULARY.size(); i++) {
        int from = 0;
        while ((from = lower.indexOf(VOCABULARY.get(i), from)) >= 0) {
          vector[i] += 1f;
          from += VOCABULARY.get(i).length();
        }
      }
      vector[VOCABULARY.size()] = 0.1f;
      return vector;
    };
  }
}
