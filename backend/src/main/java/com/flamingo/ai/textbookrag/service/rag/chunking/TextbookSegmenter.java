package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.linking.ReferenceLinker;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.CollectionKind;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns an ordered list of extracted pages into chunks.
 *
 * <p>Each page is walked header by header. Text before a header is appended to the open collection
 * if there is one, and otherwise becomes standalone text for the current structural context.
 * Reaching any header closes the open collection; exercise, example and miscellaneous headers then
 * open a new one, whose body starts with the header line itself. Chapter and section headers only
 * update the structural context for chunks created afterwards. A chapter header whose number does
 * not exceed the current chapter is treated as a running head and ignored.
 *
 * <p>Collections may span pages and are closed at the next header or at the end of the document.
 * Standalone text is assembled and linked when its page ends. Media a collection's text does not
 * cite is placed only after the last page, once every draft sharing its pages has been scanned for
 * citations, so an item cited anywhere never becomes an orphan.
 *
 * <p>The segmenter holds no per-document state; everything carried across pages lives in a {@link
 * SegmentationState} created per call, so concurrent calls for different documents are safe.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TextbookSegmenter {

  private final HeaderDetector headerDetector;
  private final ChunkAssembler chunkAssembler;
  private final ReferenceLinker referenceLinker;

  @Timed(value = "chunking.document", description = "Time to chunk one document")
  public List<Chunk> chunkDocument(List<PageRecord> pages, String documentId, String classLevel) {
    log.info("Chunking document {} ({} pages, class {})", documentId, pages.size(), classLevel);

    SegmentationState state = new SegmentationState(documentId, classLevel);
    for (PageRecord page : pages) {
      if (page == null) {
        continue;
      }
      processPage(state, page);
    }
    closeCollection(state);
    rescueDeferred(state);

    List<Chunk> chunks = new ArrayList<>();
    for (ChunkDraft draft : state.drafts()) {
      chunks.add(chunkAssembler.freeze(draft));
    }
    log.info("Created {} chunks for document {}", chunks.size(), documentId);
    return chunks;
  }

  void processPage(SegmentationState state, PageRecord page) {
    String text = page.text();
    List<ChunkDraft> pageDrafts = new ArrayList<>();
    int cursor = 0;

    for (HeaderMatch header : headerDetector.detect(text)) {
      if (isRunningHead(state, header)) {
        log.debug(
            "Ignoring repeated chapter header {} on page {}", header.label(), page.pageNumber());
        continue;
      }
      handleText(state, page, text.substring(cursor, header.start()), cursor, pageDrafts);
      closeCollection(state);
      applyHeader(state, page, header);
      cursor = header.start();
    }
    handleText(state, page, text.substring(cursor), cursor, pageDrafts);

    if (pageDrafts.isEmpty() && page.media().isEmpty()) {
      return;
    }
    OpenCollection open = state.collection();
    if (open != null && pageDrafts.isEmpty() && !state.collectionTouched(page.pageNumber())) {
      // figure-only page inside a running exercise or example
      open.includePage(page);
      state.markCollectionPage(page.pageNumber());
      return;
    }
    Map<Integer, PageRecord> pageMap = Map.of(page.pageNumber(), page);
    if (state.collectionTouched(page.pageNumber())) {
      // the page's unclaimed media is already pooled with a collection
      List<PageMedia> uncited = referenceLinker.linkExplicit(pageDrafts, page.media());
      state.recordCited(page.media(), uncited);
    } else {
      referenceLinker.link(pageDrafts, page.media(), pageMap);
    }
    state.emit(pageDrafts);
  }

  private void handleText(
      SegmentationState state,
      PageRecord page,
      String raw,
      int offset,
      List<ChunkDraft> pageDrafts) {
    String text = raw.strip();
    if (text.isEmpty()) {
      return;
    }
    OpenCollection collection = state.collection();
    if (collection != null) {
      collection.append(text, page, offset);
      state.markCollectionPage(page.pageNumber());
      return;
    }
    pageDrafts.addAll(
        chunkAssembler.assembleStandalone(
            text,
            state.context(),
            page.pageNumber(),
            offset,
            state.documentId,
            state.classLevel));
  }

  private void applyHeader(SegmentationState state, PageRecord page, HeaderMatch header) {
    switch (header.kind()) {
      case CHAPTER -> {
        int number = Integer.parseInt(header.label());
        state.setContext(state.context().withChapter(number, header.title()));
        log.debug("Entered chapter {} '{}' on page {}", number, header.title(), page.pageNumber());
      }
      case SECTION ->
          state.setContext(state.context().withSection(header.label() + " " + header.title()));
      default -> header.kind().opensCollection().ifPresent(kind -> open(state, page, header, kind));
    }
  }

  private void open(
      SegmentationState state, PageRecord page, HeaderMatch header, CollectionKind kind) {
    String label = kind == CollectionKind.MISCELLANEOUS ? null : header.label();
    state.open(new OpenCollection(kind, label, page.pageNumber(), state.context()));
    log.debug("Opened {} {} on page {}", kind.getDisplayName(), label, page.pageNumber());
  }

  private void closeCollection(SegmentationState state) {
    OpenCollection collection = state.detachCollection();
    if (collection == null || collection.isEmpty()) {
      return;
    }
    List<ChunkDraft> drafts =
        chunkAssembler.assembleCollection(collection, state.documentId, state.classLevel);
    List<PageMedia> pool = collection.mediaPool();
    List<PageMedia> uncited = referenceLinker.linkExplicit(drafts, pool);
    state.recordCited(pool, uncited);
    state.deferRescue(new SegmentationState.PendingRescue(drafts, uncited, collection.pages()));
    state.emit(drafts);
  }

  private void rescueDeferred(SegmentationState state) {
    for (SegmentationState.PendingRescue rescue : state.drainRescues()) {
      List<PageMedia> orphans =
          rescue.orphans().stream().filter(item -> !state.isCited(item)).toList();
      referenceLinker.rescueOrphans(rescue.group(), orphans, rescue.pages());
    }
  }

  private static boolean isRunningHead(SegmentationState state, HeaderMatch header) {
    return header.kind() == HeaderKind.CHAPTER
        && Integer.parseInt(header.label()) <= state.context().chapterNumber();
  }
}
