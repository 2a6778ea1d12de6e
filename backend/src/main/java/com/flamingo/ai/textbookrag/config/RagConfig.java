package com.flamingo.ai.textbookrag.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for chunking, linking and retrieval. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Linking linking = new Linking();
  private Keyword keyword = new Keyword();
  private Retrieval retrieval = new Retrieval();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk for exercise/example collections before splitting. */
    private int maxChunkSize = 2000;

    /** Approximate token budget for standalone page text (tokens ≈ chars / 4). */
    private int maxTokens = 800;
  }

  /** Configuration for attaching images and tables to chunks. */
  @Getter
  @Setter
  public static class Linking {
    /** Orphan rescue strategy: "same-page" (default) or "proximity". */
    private String orphanStrategy = "same-page";

    private Proximity proximity = new Proximity();

    @Getter
    @Setter
    public static class Proximity {
      /** Maximum centre distance in PDF units (~72 per inch) between an orphan and a text block. */
      private float maxDistance = 150.0f;
    }
  }

  /** BM25 tuning. */
  @Getter
  @Setter
  public static class Keyword {
    private double k1 = 1.5;
    private double b = 0.75;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;

    /** Smoothing constant added to each rank in reciprocal-rank fusion. */
    private int rankConstant = 60;

    /** Vector share of the fused score for concept questions. */
    private double defaultAlpha = 0.7;

    /** Vector share of the fused score for numbered example/exercise lookups. */
    private double entityAlpha = 0.3;

    /** Each search fetches {@code topK * candidateMultiplier} candidates before fusion. */
    private int candidateMultiplier = 2;

    /** Maximum distance between the bounds of an example range ("examples 2 to 5"). */
    private int rangeCap = 10;

    /** Results fetched per example number when resolving a range. */
    private int perNumberTopK = 2;
  }
}
