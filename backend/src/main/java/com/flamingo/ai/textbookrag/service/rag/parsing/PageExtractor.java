package com.flamingo.ai.textbookrag.service.rag.parsing;

import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import java.io.InputStream;
import java.util.List;

/** Produces per-page records from a source document. */
public interface PageExtractor {

  /**
   * Extracts every page of the document, in page order.
   *
   * @param inputStream document bytes; not closed by the extractor
   * @param documentId id used in diagnostics and error reports
   * @return one record per page
   * @throws com.flamingo.ai.textbookrag.exception.DocumentProcessingException if the document
   *     cannot be read
   */
  List<PageRecord> extract(InputStream inputStream, String documentId);

  boolean supports(String mimeType);
}
