package com.flamingo.ai.textbookrag.api.dto.request;

import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for searching indexed textbooks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Number of results. If null, uses {@code rag.retrieval.top-k}. */
  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 50, message = "topK must not exceed 50")
  private Integer topK;

  // Optional metadata filters
  private String documentId;
  private String classLevel;
  private Integer chapterNumber;

  /** Content type value such as "definition" or "example". */
  private String contentType;

  private String exampleNumber;
  private String exerciseNumber;

  /**
   * Builds the metadata filter from the optional fields.
   *
   * @throws IllegalArgumentException if {@code contentType} is not a known content type
   */
  public ChunkFilter toFilter() {
    ContentType type =
        contentType == null || contentType.isBlank()
            ? null
            : ContentType.valueOf(contentType.strip().toUpperCase(Locale.ROOT));
    return new ChunkFilter(
        documentId, classLevel, chapterNumber, type, exampleNumber, exerciseNumber);
  }
}
