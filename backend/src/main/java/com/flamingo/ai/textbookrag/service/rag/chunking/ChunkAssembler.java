package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.CollectionKind;
import com.flamingo.ai.textbookrag.service.rag.model.StructuralContext;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Packages accumulated text into bounded chunk drafts.
 *
 * <p>Collection bodies are bounded by characters ({@code rag.chunking.max-chunk-size}). A body that
 * fits is emitted whole; otherwise it is split greedily at paragraph boundaries, then at sentence
 * boundaries, then by character count, and every part after the first receives a continuation
 * header such as {@code "Exercise 3.1 (Part 2)"}. All parts record the full page span of the body
 * so that any of them can claim media collected anywhere in it.
 *
 * <p>Standalone page text is bounded by an approximate token budget ({@code
 * rag.chunking.max-tokens}) instead, and each part's content type is detected from its text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChunkAssembler {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  private final RagConfig ragConfig;
  private final ContentClassifier contentClassifier;

  /** A paragraph and the page/offset of the segment it came from. */
  private record Paragraph(String text, int page, int offset) {}

  public List<ChunkDraft> assembleCollection(
      OpenCollection collection, String documentId, String classLevel) {
    List<Paragraph> paragraphs = new ArrayList<>();
    for (OpenCollection.Segment segment : collection.segments()) {
      for (String paragraph : paragraphs(segment.text())) {
        paragraphs.add(new Paragraph(paragraph, segment.page(), segment.offset()));
      }
    }
    if (paragraphs.isEmpty()) {
      return List.of();
    }

    int maxChars = ragConfig.getChunking().getMaxChunkSize();
    CollectionKind kind = collection.kind();
    String label = collection.label();
    List<List<Paragraph>> parts;
    if (joinedLength(paragraphs) <= maxChars) {
      parts = List.of(paragraphs);
    } else {
      parts = packWithHeaderRoom(paragraphs, kind, label, maxChars);
    }

    List<ChunkDraft> drafts = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      List<Paragraph> part = parts.get(i);
      String text = join(part);
      int partNumber = i + 1;
      if (partNumber > 1) {
        String header = continuationHeader(kind, label, partNumber);
        if (!text.startsWith(header.strip())) {
          text = header + text;
        }
      }
      drafts.add(
          ChunkDraft.builder()
              .documentId(documentId)
              .classLevel(classLevel)
              .context(collection.context())
              .contentType(kind.getContentType())
              .pageNumber(part.get(0).page())
              .pageNumbers(collection.pageSpan())
              .text(text)
              .exerciseNumber(kind == CollectionKind.EXERCISE ? label : null)
              .exampleNumber(kind == CollectionKind.EXAMPLE ? label : null)
              .partNumber(partNumber)
              .totalParts(parts.size())
              .offset(part.get(0).offset())
              .build());
    }
    if (drafts.size() > 1) {
      log.debug(
          "Split {} {} on page {} into {} parts",
          kind.getDisplayName(),
          label,
          collection.startPage(),
          drafts.size());
    }
    return drafts;
  }

  public List<ChunkDraft> assembleStandalone(
      String text,
      StructuralContext context,
      int pageNumber,
      int offset,
      String documentId,
      String classLevel) {
    List<String> parts = splitByTokens(text, ragConfig.getChunking().getMaxTokens());
    List<ChunkDraft> drafts = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      String part = parts.get(i);
      drafts.add(
          ChunkDraft.builder()
              .documentId(documentId)
              .classLevel(classLevel)
              .context(context)
              .contentType(contentClassifier.detect(part))
              .pageNumber(pageNumber)
              .pageNumbers(List.of(pageNumber))
              .text(part)
              .partNumber(i + 1)
              .totalParts(parts.size())
              .offset(offset)
              .build());
    }
    return drafts;
  }

  public Chunk freeze(ChunkDraft draft) {
    return draft.freeze(contentClassifier);
  }

  /**
   * Splits text at paragraph boundaries so that every part is at most {@code maxChars} long.
   * Paragraph order is preserved; paragraphs longer than the limit are split by sentence and then
   * cut.
   */
  public static List<String> splitBySize(String text, int maxChars) {
    List<Paragraph> paragraphs = new ArrayList<>();
    for (String paragraph : paragraphs(text)) {
      paragraphs.add(new Paragraph(paragraph, 0, 0));
    }
    List<String> parts = new ArrayList<>();
    for (List<Paragraph> part : packParagraphs(paragraphs, maxChars)) {
      parts.add(join(part));
    }
    return parts;
  }

  /**
   * Packs paragraphs leaving room for the longest continuation header the result needs. The room
   * starts at a one-digit part number and grows until the part count fits it.
   *
   * @throws IllegalStateException if {@code maxChars} leaves less room for text than the header
   *     itself takes
   */
  private static List<List<Paragraph>> packWithHeaderRoom(
      List<Paragraph> paragraphs, CollectionKind kind, String label, int maxChars) {
    int largestPart = 9;
    while (true) {
      int reserve = continuationHeader(kind, label, largestPart).length();
      if (maxChars < 2 * reserve) {
        throw new IllegalStateException(
            "rag.chunking.max-chunk-size "
                + maxChars
                + " is too small for continuation header '"
                + continuationHeader(kind, label, largestPart).strip()
                + "'");
      }
      List<List<Paragraph>> parts = packParagraphs(paragraphs, maxChars - reserve);
      if (parts.size() <= largestPart) {
        return parts;
      }
      largestPart = largestPart * 10 + 9;
    }
  }

  static String continuationHeader(CollectionKind kind, String label, int partNumber) {
    String name = label == null ? kind.getDisplayName() : kind.getDisplayName() + " " + label;
    return name + " (Part " + partNumber + ")" + PARAGRAPH_SEPARATOR;
  }

  static int estimateTokens(String text) {
    return text.length() / 4;
  }

  private static List<List<Paragraph>> packParagraphs(List<Paragraph> paragraphs, int limit) {
    List<List<Paragraph>> parts = new ArrayList<>();
    List<Paragraph> current = new ArrayList<>();
    int currentLength = 0;
    for (Paragraph paragraph : paragraphs) {
      for (String piece : fitToLimit(paragraph.text(), limit)) {
        int added =
            current.isEmpty() ? piece.length() : PARAGRAPH_SEPARATOR.length() + piece.length();
        if (!current.isEmpty() && currentLength + added > limit) {
          parts.add(current);
          current = new ArrayList<>();
          currentLength = 0;
          added = piece.length();
        }
        current.add(new Paragraph(piece, paragraph.page(), paragraph.offset()));
        currentLength += added;
      }
    }
    if (!current.isEmpty()) {
      parts.add(current);
    }
    return parts;
  }

  private static List<String> splitByTokens(String text, int maxTokens) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int maxChars = maxTokens * 4;
    for (String paragraph : paragraphs(text)) {
      for (String piece : fitToLimit(paragraph, maxChars)) {
        int joined = current.length() + PARAGRAPH_SEPARATOR.length() + piece.length();
        if (current.length() > 0 && joined / 4 > maxTokens) {
          parts.add(current.toString());
          current.setLength(0);
        }
        if (current.length() > 0) {
          current.append(PARAGRAPH_SEPARATOR);
        }
        current.append(piece);
      }
    }
    if (current.length() > 0) {
      parts.add(current.toString());
    }
    return parts;
  }

  /** Pieces of one paragraph, each at most {@code limit} characters. */
  private static List<String> fitToLimit(String paragraph, int limit) {
    if (paragraph.length() <= limit) {
      return List.of(paragraph);
    }
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_BREAK.split(paragraph)) {
      if (sentence.length() > limit) {
        if (current.length() > 0) {
          pieces.add(current.toString());
          current.setLength(0);
        }
        for (int i = 0; i < sentence.length(); i += limit) {
          pieces.add(sentence.substring(i, Math.min(i + limit, sentence.length())));
        }
        continue;
      }
      int added = current.length() == 0 ? sentence.length() : sentence.length() + 1;
      if (current.length() > 0 && current.length() + added > limit) {
        pieces.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(sentence);
    }
    if (current.length() > 0) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  private static List<String> paragraphs(String text) {
    List<String> paragraphs = new ArrayList<>();
    if (text == null) {
      return paragraphs;
    }
    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      String trimmed = paragraph.strip();
      if (!trimmed.isEmpty()) {
        paragraphs.add(trimmed);
      }
    }
    return paragraphs;
  }

  private static int joinedLength(List<Paragraph> paragraphs) {
    int length = 0;
    for (Paragraph paragraph : paragraphs) {
      length += paragraph.text().length();
    }
    return length + PARAGRAPH_SEPARATOR.length() * (paragraphs.size() - 1);
  }

  private static String join(List<Paragraph> paragraphs) {
    StringBuilder sb = new StringBuilder();
    for (Paragraph paragraph : paragraphs) {
      if (sb.length() > 0) {
        sb.append(PARAGRAPH_SEPARATOR);
      }
      sb.append(paragraph.text());
    }
    return sb.toString();
  }
}
