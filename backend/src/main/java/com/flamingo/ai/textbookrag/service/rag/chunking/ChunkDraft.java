package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.PageImage;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageTable;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;

/**
 * A chunk under construction. Text and metadata are fixed at creation; media is appended by the
 * reference linker during the same assembly pass, then the draft is frozen into a {@link Chunk}.
 */
@Getter
public class ChunkDraft {

  private final String documentId;
  private final String classLevel;
  private final StructuralContext context;
  private final ContentType contentType;
  private final int pageNumber;
  private final List<Integer> pageNumbers;
  private final String text;
  private final String exerciseNumber;
  private final String exampleNumber;
  private final int partNumber;
  private final int totalParts;

  /** Offset on {@link #pageNumber} where the text starts; orders drafts within a page. */
  private final int offset;

  private final Map<String, PageMedia> media = new LinkedHashMap<>();

  @Builder
  private ChunkDraft(
      String documentId,
      String classLevel,
      StructuralContext context,
      ContentType contentType,
      int pageNumber,
      List<Integer> pageNumbers,
      String text,
      String exerciseNumber,
      String exampleNumber,
      int partNumber,
      int totalParts,
      int offset) {
    this.documentId = documentId;
    this.classLevel = classLevel;
    this.context = context;
    this.contentType = contentType;
    this.pageNumber = pageNumber;
    this.pageNumbers = pageNumbers == null ? List.of(pageNumber) : List.copyOf(pageNumbers);
    this.text = text == null ? "" : text;
    this.exerciseNumber = exerciseNumber;
    this.exampleNumber = exampleNumber;
    this.partNumber = partNumber <= 0 ? 1 : partNumber;
    this.totalParts = totalParts <= 0 ? 1 : totalParts;
    this.offset = offset;
  }

  /**
   * Attaches a media item unless it is already attached or lies outside this draft's page span.
   *
   * @return {@code true} if the item was newly attached
   */
  public boolean attach(PageMedia item) {
    if (!pageNumbers.contains(item.pageNumber())) {
      return false;
    }
    return media.putIfAbsent(key(item), item) == null;
  }

  public boolean holds(PageMedia item) {
    return media.containsKey(key(item));
  }

  public List<PageMedia> attachedMedia() {
    return List.copyOf(media.values());
  }

  Chunk freeze(ContentClassifier classifier) {
    List<PageImage> images = new ArrayList<>();
    List<PageTable> tables = new ArrayList<>();
    for (PageMedia item : media.values()) {
      if (item instanceof PageImage image) {
        images.add(image);
      } else if (item instanceof PageTable table) {
        tables.add(table);
      }
    }
    return Chunk.builder()
        .chunkId(UUID.randomUUID().toString())
        .documentId(documentId)
        .classLevel(classLevel)
        .context(context)
        .contentType(contentType)
        .pageNumber(pageNumber)
        .pageNumbers(pageNumbers)
        .text(text)
        .equations(classifier.extractEquations(text))
        .images(images)
        .tables(tables)
        .exerciseNumber(exerciseNumber)
        .exampleNumber(exampleNumber)
        .partNumber(partNumber)
        .totalParts(totalParts)
        .charCount(text.length())
        .tokenCount(ChunkAssembler.estimateTokens(text))
        .mathDensity(classifier.mathDensity(text))
        .build();
  }

  private static String key(PageMedia item) {
    return item.kind() + ":" + item.id();
  }
}
