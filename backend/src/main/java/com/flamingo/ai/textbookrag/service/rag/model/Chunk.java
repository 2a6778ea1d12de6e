package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.List;
import lombok.Builder;

/**
 * A retrievable content unit with structural and media metadata. Created once by the chunk
 * assembler and never mutated afterwards.
 *
 * @param chunkId unique id
 * @param documentId owning document
 * @param classLevel class/grade level the book belongs to, e.g. {@code "11"}
 * @param context chapter/section the chunk was found in
 * @param contentType single content classification
 * @param pageNumber page where the chunk's text starts
 * @param pageNumbers recorded page span; every linked image/table lies on one of these pages
 * @param text full chunk text
 * @param equations delimited equations found in {@code text}
 * @param images linked images
 * @param tables linked tables
 * @param exerciseNumber exercise label such as {@code "3.1"}, when the chunk is a numbered exercise
 * @param exampleNumber example label such as {@code "5"}, when the chunk is a numbered example
 * @param partNumber 1-based index among the parts its buffer was split into
 * @param totalParts number of parts its buffer was split into
 * @param charCount length of {@code text}
 * @param tokenCount estimated token count of {@code text}
 * @param mathDensity share of mathematical content in {@code text}, 0..1
 */
@Builder(toBuilder = true)
public record Chunk(
    String chunkId,
    String documentId,
    String classLevel,
    StructuralContext context,
    ContentType contentType,
    int pageNumber,
    List<Integer> pageNumbers,
    String text,
    List<EquationData> equations,
    List<PageImage> images,
    List<PageTable> tables,
    String exerciseNumber,
    String exampleNumber,
    int partNumber,
    int totalParts,
    int charCount,
    int tokenCount,
    double mathDensity) {

  public Chunk {
    context = context == null ? StructuralContext.initial() : context;
    contentType = contentType == null ? ContentType.TEXT : contentType;
    text = text == null ? "" : text;
    pageNumbers = pageNumbers == null ? List.of(pageNumber) : List.copyOf(pageNumbers);
    equations = equations == null ? List.of() : List.copyOf(equations);
    images = images == null ? List.of() : List.copyOf(images);
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  public int chapterNumber() {
    return context.chapterNumber();
  }

  /** The exercise or example label, whichever is set. */
  public String label() {
    return exerciseNumber != null ? exerciseNumber : exampleNumber;
  }

  /**
   * Text rendering of the chunk with its location and attachments, used as context for answer
   * generation.
   */
  public String fullContext() {
    StringBuilder sb = new StringBuilder();
    sb.append("Class ")
        .append(classLevel)
        .append(" | Chapter ")
        .append(context.chapterNumber())
        .append(": ")
        .append(context.chapterName())
        .append('\n');
    if (!context.sectionName().isEmpty()) {
      sb.append("Section: ").append(context.sectionName()).append('\n');
    }
    sb.append("Content Type: ").append(contentType.name()).append("\n\n");
    sb.append(text);
    if (!equations.isEmpty()) {
      sb.append("\n\nEquations:");
      for (EquationData eq : equations) {
        sb.append("\n  ").append(eq.latex());
      }
    }
    if (!tables.isEmpty()) {
      sb.append("\n\n[Contains ").append(tables.size()).append(" table(s)]");
    }
    if (!images.isEmpty()) {
      sb.append("\n\n[Contains ").append(images.size()).append(" image(s)]");
      for (PageImage image : images) {
        if (!image.caption().isBlank()) {
          sb.append("\n  - ").append(image.caption());
        }
      }
    }
    return sb.toString();
  }
}
