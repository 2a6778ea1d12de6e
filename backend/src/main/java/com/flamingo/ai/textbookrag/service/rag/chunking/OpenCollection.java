package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.model.CollectionKind;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulates the body of an exercise, example or miscellaneous-exercise header until the next
 * header or the end of the document. Every page the body draws text from contributes its media to
 * the collection's pool.
 */
final class OpenCollection {

  /** A run of collected text and where it was found. */
  record Segment(String text, int page, int offset) {}

  private final CollectionKind kind;
  private final String label;
  private final int startPage;
  private final StructuralContext context;
  private final List<Segment> segments = new ArrayList<>();
  private final Map<Integer, PageRecord> pages = new TreeMap<>();
  private final Map<String, PageMedia> media = new LinkedHashMap<>();

  OpenCollection(CollectionKind kind, String label, int startPage, StructuralContext context) {
    this.kind = kind;
    this.label = label;
    this.startPage = startPage;
    this.context = context;
  }

  void append(String text, PageRecord page, int offset) {
    segments.add(new Segment(text, page.pageNumber(), offset));
    includePage(page);
  }

  /** Adds the page to the body's span and its media to the pool, once per page. */
  void includePage(PageRecord page) {
    if (pages.putIfAbsent(page.pageNumber(), page) == null) {
      for (PageMedia item : page.media()) {
        media.putIfAbsent(item.kind() + ":" + item.id(), item);
      }
    }
  }

  boolean isEmpty() {
    return segments.stream().allMatch(s -> s.text().isBlank());
  }

  CollectionKind kind() {
    return kind;
  }

  String label() {
    return label;
  }

  int startPage() {
    return startPage;
  }

  StructuralContext context() {
    return context;
  }

  List<Segment> segments() {
    return segments;
  }

  /** Page numbers the body spans, ascending. */
  List<Integer> pageSpan() {
    return List.copyOf(pages.keySet());
  }

  Map<Integer, PageRecord> pages() {
    return pages;
  }

  List<PageMedia> mediaPool() {
    return List.copyOf(media.values());
  }
}
