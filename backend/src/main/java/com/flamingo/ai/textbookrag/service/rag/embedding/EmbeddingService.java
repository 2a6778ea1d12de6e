package com.flamingo.ai.textbookrag.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingProvider} backed by the configured LangChain4j {@link EmbeddingModel}. Chunk text
 * and queries are embedded the same way. Failures are retried, then propagate to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements EmbeddingProvider {

  // text-embedding-3-small accepts 8192 tokens; stay well below it
  static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.embed", description = "Time to embed text")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public float[] embed(String text) {
    String input = text == null ? "" : text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    log.debug("Embedding {} chars", input.length());

    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success").increment();
    return response.content().vector();
  }
}
