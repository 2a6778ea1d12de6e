package com.flamingo.ai.textbookrag.service.rag.model;

/**
 * Where in the book a chunk was found. Replaced (never mutated) when the segmenter crosses a
 * chapter or section header.
 *
 * @param chapterNumber current chapter number, 0 before the first chapter header
 * @param chapterName current chapter name
 * @param sectionName current section heading, empty when none has been seen in this chapter
 */
public record StructuralContext(int chapterNumber, String chapterName, String sectionName) {

  public StructuralContext {
    chapterName = chapterName == null ? "" : chapterName;
    sectionName = sectionName == null ? "" : sectionName;
  }

  public static StructuralContext initial() {
    return new StructuralContext(0, "Introduction", "");
  }

  /** Entering a new chapter clears the section. */
  public StructuralContext withChapter(int number, String name) {
    return new StructuralContext(number, name, "");
  }

  public StructuralContext withSection(String name) {
    return new StructuralContext(chapterNumber, chapterName, name);
  }
}
