package com.flamingo.ai.textbookrag.service.document;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for the document lifecycle: indexing, listing and deletion. */
public interface DocumentService {

  /**
   * Chunks, embeds and indexes a document from extracted pages. An already indexed document with
   * the same id is replaced.
   *
   * @param documentId the document ID
   * @param classLevel class level of the book
   * @param pages extracted pages in order
   * @return indexing statistics
   */
  IndexingStats indexDocument(String documentId, String classLevel, List<PageRecord> pages);

  /**
   * Extracts pages from an uploaded PDF and indexes them.
   *
   * @param documentId the document ID
   * @param classLevel class level of the book
   * @param file the uploaded file
   * @return indexing statistics
   * @throws com.flamingo.ai.textbookrag.exception.DocumentProcessingException if the file cannot
   *     be read or is not a PDF
   */
  IndexingStats indexPdf(String documentId, String classLevel, MultipartFile file);

  /**
   * Deletes a document's chunks from every store.
   *
   * @param documentId the document ID
   * @return number of removed chunks
   * @throws com.flamingo.ai.textbookrag.exception.DocumentNotFoundException if nothing is indexed
   *     for the id
   */
  int deleteDocument(String documentId);

  List<DocumentSummary> listDocuments();

  /**
   * Gets the stored chunks of a document, in document order.
   *
   * @throws com.flamingo.ai.textbookrag.exception.DocumentNotFoundException if not found
   */
  List<Chunk> getChunks(String documentId);

  IndexStats getStats();
}
