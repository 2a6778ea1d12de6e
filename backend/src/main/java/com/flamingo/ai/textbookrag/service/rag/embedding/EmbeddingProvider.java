package com.flamingo.ai.textbookrag.service.rag.embedding;

/** Turns text into a dense vector. Deterministic for a fixed model and input. */
public interface EmbeddingProvider {

  float[] embed(String text);
}
