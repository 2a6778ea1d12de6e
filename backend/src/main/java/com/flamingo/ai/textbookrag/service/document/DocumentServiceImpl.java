package com.flamingo.ai.textbookrag.service.document;

import com.flamingo.ai.textbookrag.exception.DocumentNotFoundException;
import com.flamingo.ai.textbookrag.exception.DocumentProcessingException;
import com.flamingo.ai.textbookrag.service.rag.chunking.TextbookSegmenter;
import com.flamingo.ai.textbookrag.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.parsing.PageExtractor;
import com.flamingo.ai.textbookrag.service.rag.search.ChunkStore;
import com.flamingo.ai.textbookrag.service.rag.search.KeywordIndex;
import com.flamingo.ai.textbookrag.service.rag.search.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the DocumentService.
 *
 * <p>Indexing and deletion are serialized: the segmenter carries state across the pages of one
 * document, and the keyword index is rebuilt from the whole chunk store after every change.
 * Chunks and embeddings are computed before the previous version of a document is removed, so a
 * failed re-index leaves the old version searchable.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

  private final TextbookSegmenter textbookSegmenter;
  private final EmbeddingProvider embeddingProvider;
  private final VectorIndex vectorIndex;
  private final KeywordIndex keywordIndex;
  private final ChunkStore chunkStore;
  private final PageExtractor pageExtractor;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.index", description = "Time to index a document")
  public synchronized IndexingStats indexDocument(
      String documentId, String classLevel, List<PageRecord> pages) {
    requireText(documentId, "documentId");
    requireText(classLevel, "classLevel");
    long start = System.currentTimeMillis();
    List<PageRecord> input = pages == null ? List.of() : pages;
    log.info("Indexing document {} (class {}, {} pages)", documentId, classLevel, input.size());

    List<Chunk> chunks = textbookSegmenter.chunkDocument(input, documentId, classLevel);
    List<float[]> vectors = new ArrayList<>(chunks.size());
    List<String> ids = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      vectors.add(embeddingProvider.embed(chunk.text()));
      ids.add(chunk.chunkId());
    }

    List<String> previous = chunkStore.deleteByDocument(documentId);
    if (!previous.isEmpty()) {
      vectorIndex.remove(previous);
      log.info("Replaced {} chunks of earlier version of {}", previous.size(), documentId);
    }
    vectorIndex.add(vectors, ids);
    chunkStore.put(chunks);
    keywordIndex.index(chunkStore.all());

    long duration = System.currentTimeMillis() - start;
    meterRegistry.counter("document.indexed").increment();
    meterRegistry.counter("document.chunks.created").increment(chunks.size());
    log.info("Indexed document {}: {} chunks in {} ms", documentId, chunks.size(), duration);
    return new IndexingStats(
        documentId, input.size(), chunks.size(), !previous.isEmpty(), duration);
  }

  @Override
  public IndexingStats indexPdf(String documentId, String classLevel, MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new DocumentProcessingException(documentId, "File is empty");
    }
    if (!pageExtractor.supports(file.getContentType())) {
      throw new DocumentProcessingException(
          documentId, "Unsupported file type: " + file.getContentType());
    }
    List<PageRecord> pages;
    try (InputStream in = file.getInputStream()) {
      pages = pageExtractor.extract(in, documentId);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          documentId, "Failed to read upload: " + e.getMessage(), e);
    }
    return indexDocument(documentId, classLevel, pages);
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public synchronized int deleteDocument(String documentId) {
    List<String> removed = chunkStore.deleteByDocument(documentId);
    if (removed.isEmpty()) {
      throw new DocumentNotFoundException(documentId);
    }
    vectorIndex.remove(removed);
    keywordIndex.index(chunkStore.all());
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document {} ({} chunks)", documentId, removed.size());
    return removed.size();
  }

  @Override
  public List<DocumentSummary> listDocuments() {
    Map<String, List<Chunk>> byDocument = new LinkedHashMap<>();
    for (Chunk chunk : chunkStore.all()) {
      byDocument.computeIfAbsent(chunk.documentId(), id -> new ArrayList<>()).add(chunk);
    }
    List<DocumentSummary> summaries = new ArrayList<>(byDocument.size());
    byDocument.forEach(
        (documentId, chunks) ->
            summaries.add(
                new DocumentSummary(
                    documentId,
                    chunks.get(0).classLevel(),
                    chunks.size(),
                    List.copyOf(
                        chunks.stream()
                            .map(Chunk::chapterNumber)
                            .collect(Collectors.toCollection(TreeSet::new))))));
    return summaries;
  }

  @Override
  public List<Chunk> getChunks(String documentId) {
    List<Chunk> chunks =
        chunkStore.filter(new ChunkFilter(documentId, null, null, null, null, null));
    if (chunks.isEmpty()) {
      throw new DocumentNotFoundException(documentId);
    }
    return chunks;
  }

  @Override
  public IndexStats getStats() {
    List<Chunk> all = chunkStore.all();
    Map<String, Long> byType =
        all.stream()
            .collect(
                Collectors.groupingBy(
                    c -> c.contentType().value(), TreeMap::new, Collectors.counting()));
    int documents = (int) all.stream().map(Chunk::documentId).distinct().count();
    return new IndexStats(documents, all.size(), vectorIndex.size(), keywordIndex.size(), byType);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
