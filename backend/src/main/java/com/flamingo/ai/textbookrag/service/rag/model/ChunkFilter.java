package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.Objects;

/**
 * Exact-match metadata predicates over chunks. Every non-null field must match; a filter with all
 * fields null matches everything.
 *
 * @param documentId owning document
 * @param classLevel class level
 * @param chapterNumber chapter number
 * @param contentType content type
 * @param exampleNumber example label
 * @param exerciseNumber exercise label
 */
public record ChunkFilter(
    String documentId,
    String classLevel,
    Integer chapterNumber,
    ContentType contentType,
    String exampleNumber,
    String exerciseNumber) {

  private static final ChunkFilter NONE = new ChunkFilter(null, null, null, null, null, null);

  public static ChunkFilter none() {
    return NONE;
  }

  public static ChunkFilter forChapter(String classLevel, int chapterNumber) {
    return new ChunkFilter(null, classLevel, chapterNumber, null, null, null);
  }

  public boolean isEmpty() {
    return documentId == null
        && classLevel == null
        && chapterNumber == null
        && contentType == null
        && exampleNumber == null
        && exerciseNumber == null;
  }

  public boolean matches(Chunk chunk) {
    return (documentId == null || documentId.equals(chunk.documentId()))
        && (classLevel == null || classLevel.equals(chunk.classLevel()))
        && (chapterNumber == null || chapterNumber == chunk.chapterNumber())
        && (contentType == null || contentType == chunk.contentType())
        && (exampleNumber == null || exampleNumber.equals(chunk.exampleNumber()))
        && (exerciseNumber == null || exerciseNumber.equals(chunk.exerciseNumber()));
  }

  public ChunkFilter withContentType(ContentType type) {
    return new ChunkFilter(
        documentId, classLevel, chapterNumber, type, exampleNumber, exerciseNumber);
  }

  public ChunkFilter withExampleNumber(String number) {
    return new ChunkFilter(
        documentId, classLevel, chapterNumber, contentType, number, exerciseNumber);
  }

  /** Null-safe: a {@code null} filter is treated as {@link #none()}. */
  public static ChunkFilter orNone(ChunkFilter filter) {
    return Objects.requireNonNullElse(filter, NONE);
  }
}
