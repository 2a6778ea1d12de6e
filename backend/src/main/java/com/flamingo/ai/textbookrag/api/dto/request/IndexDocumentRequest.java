package com.flamingo.ai.textbookrag.api.dto.request;

import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing a document from already extracted pages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexDocumentRequest {

  @NotBlank(message = "Document ID is required")
  @Size(max = 200, message = "Document ID must not exceed 200 characters")
  private String documentId;

  @NotBlank(message = "Class level is required")
  private String classLevel;

  /** Extracted pages in reading order. */
  @NotEmpty(message = "At least one page is required")
  private List<PageRecord> pages;
}
