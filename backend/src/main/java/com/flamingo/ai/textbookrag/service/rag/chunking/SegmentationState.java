package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the segmenter carries from one page to the next within a single document: the
 * structural context, the open collection, and the drafts emitted so far.
 *
 * <p>It also records every media item some draft cited explicitly. Orphan placement for closed
 * collections waits until the whole document is read, since standalone text sharing a page with a
 * collection may cite an item from the collection's pool after the collection has closed.
 */
final class SegmentationState {

  private record Emitted(ChunkDraft draft, long sequence) {}

  /** Uncited media of a closed collection, waiting for orphan placement. */
  record PendingRescue(
      List<ChunkDraft> group, List<PageMedia> orphans, Map<Integer, PageRecord> pages) {}

  private static final Comparator<Emitted> DOCUMENT_ORDER =
      Comparator.<Emitted>comparingInt(e -> e.draft().getPageNumber())
          .thenComparingInt(e -> e.draft().getOffset())
          .thenComparingLong(Emitted::sequence);

  final String documentId;
  final String classLevel;

  private StructuralContext context = StructuralContext.initial();
  private OpenCollection collection;
  private final List<Emitted> emitted = new ArrayList<>();
  private final Set<Integer> collectionPages = new HashSet<>();
  private final Set<String> cited = new HashSet<>();
  private final List<PendingRescue> pendingRescues = new ArrayList<>();
  private long sequence;

  SegmentationState(String documentId, String classLevel) {
    this.documentId = documentId;
    this.classLevel = classLevel;
  }

  StructuralContext context() {
    return context;
  }

  void setContext(StructuralContext context) {
    this.context = context;
  }

  OpenCollection collection() {
    return collection;
  }

  void open(OpenCollection collection) {
    this.collection = collection;
  }

  /** Detaches and returns the open collection, or {@code null} if none is open. */
  OpenCollection detachCollection() {
    OpenCollection closed = collection;
    collection = null;
    return closed;
  }

  void markCollectionPage(int pageNumber) {
    collectionPages.add(pageNumber);
  }

  boolean collectionTouched(int pageNumber) {
    return collectionPages.contains(pageNumber);
  }

  /** Records the pool items that are not in {@code orphans} as explicitly cited. */
  void recordCited(Collection<? extends PageMedia> pool, List<PageMedia> orphans) {
    for (PageMedia item : pool) {
      if (!orphans.contains(item)) {
        cited.add(key(item));
      }
    }
  }

  boolean isCited(PageMedia item) {
    return cited.contains(key(item));
  }

  void deferRescue(PendingRescue rescue) {
    pendingRescues.add(rescue);
  }

  /** Returns the deferred rescues in closing order and forgets them. */
  List<PendingRescue> drainRescues() {
    List<PendingRescue> drained = List.copyOf(pendingRescues);
    pendingRescues.clear();
    return drained;
  }

  void emit(List<ChunkDraft> drafts) {
    for (ChunkDraft draft : drafts) {
      emitted.add(new Emitted(draft, sequence++));
    }
  }

  private static String key(PageMedia item) {
    return item.kind() + ":" + item.id();
  }

  /** Emitted drafts ordered by start page, then offset on that page, then emission order. */
  List<ChunkDraft> drafts() {
    return emitted.stream().sorted(DOCUMENT_ORDER).map(Emitted::draft).toList();
  }
}
