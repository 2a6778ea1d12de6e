package com.flamingo.ai.textbookrag.api.rest;

import com.flamingo.ai.textbookrag.api.dto.request.IndexDocumentRequest;
import com.flamingo.ai.textbookrag.api.dto.response.ChunkResponse;
import com.flamingo.ai.textbookrag.api.dto.response.IndexingResponse;
import com.flamingo.ai.textbookrag.service.document.DocumentService;
import com.flamingo.ai.textbookrag.service.document.DocumentSummary;
import com.flamingo.ai.textbookrag.service.document.IndexStats;
import com.flamingo.ai.textbookrag.service.document.IndexingStats;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for textbook indexing. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Indexes a document from extracted pages, replacing any earlier version. */
  @PostMapping(value = "/documents", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IndexingResponse> indexDocument(
      @Valid @RequestBody IndexDocumentRequest request) {
    IndexingStats stats =
        documentService.indexDocument(
            request.getDocumentId(), request.getClassLevel(), request.getPages());
    return ResponseEntity.status(HttpStatus.CREATED).body(IndexingResponse.fromStats(stats));
  }

  /** Extracts pages from an uploaded PDF and indexes them. */
  @PostMapping(value = "/documents/pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IndexingResponse> uploadPdf(
      @RequestParam("file") MultipartFile file,
      @RequestParam("documentId") String documentId,
      @RequestParam("classLevel") String classLevel) {
    IndexingStats stats = documentService.indexPdf(documentId, classLevel, file);
    return ResponseEntity.status(HttpStatus.CREATED).body(IndexingResponse.fromStats(stats));
  }

  @GetMapping("/documents")
  public ResponseEntity<List<DocumentSummary>> listDocuments() {
    return ResponseEntity.ok(documentService.listDocuments());
  }

  /** Gets the chunks of a document in reading order. */
  @GetMapping("/documents/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable String documentId) {
    List<ChunkResponse> chunks =
        documentService.getChunks(documentId).stream().map(ChunkResponse::fromChunk).toList();
    return ResponseEntity.ok(chunks);
  }

  @DeleteMapping("/documents/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable String documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }

  /** Returns index statistics. */
  @GetMapping("/stats")
  public ResponseEntity<IndexStats> stats() {
    return ResponseEntity.ok(documentService.getStats());
  }
}
