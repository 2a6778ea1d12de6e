package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the extractor produced for one page. Immutable input to chunking.
 *
 * <p>Malformed fields are normalized rather than rejected: missing text becomes the empty string,
 * missing lists become empty, media without an identifier is dropped, and media page numbers are
 * forced to this record's page.
 *
 * @param pageNumber 1-based page number
 * @param text full page text
 * @param blocks positioned text blocks in reading order
 * @param images images detected on the page
 * @param tables tables detected on the page
 */
public record PageRecord(
    int pageNumber,
    String text,
    List<TextBlock> blocks,
    List<PageImage> images,
    List<PageTable> tables) {

  public PageRecord {
    text = text == null ? "" : text;
    blocks = blocks == null ? List.of() : blocks.stream().filter(Objects::nonNull).toList();
    final int page = pageNumber;
    images =
        images == null
            ? List.of()
            : images.stream()
                .filter(i -> i != null && i.imageId() != null && !i.imageId().isBlank())
                .map(i -> i.onPage(page))
                .toList();
    tables =
        tables == null
            ? List.of()
            : tables.stream()
                .filter(t -> t != null && t.tableId() != null && !t.tableId().isBlank())
                .map(t -> t.onPage(page))
                .toList();
  }

  /** Convenience factory for text-only pages. */
  public static PageRecord ofText(int pageNumber, String text) {
    return new PageRecord(pageNumber, text, List.of(), List.of(), List.of());
  }

  /** Images followed by tables, in extractor order. */
  public List<PageMedia> media() {
    List<PageMedia> media = new ArrayList<>(images);
    media.addAll(tables);
    return media;
  }
}
