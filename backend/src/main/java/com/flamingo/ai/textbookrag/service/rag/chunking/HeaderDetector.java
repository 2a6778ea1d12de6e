package com.flamingo.ai.textbookrag.service.rag.chunking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds structural headers in page text. Each family is matched independently; the results are
 * merged in offset order and a match that starts inside an earlier one is discarded.
 */
@Component
public class HeaderDetector {

  private static final Map<HeaderKind, Pattern> PATTERNS = new EnumMap<>(HeaderKind.class);

  static {
    PATTERNS.put(
        HeaderKind.CHAPTER,
        Pattern.compile(
            "(?m)^[ \\t]*(?:CHAPTER|Chapter)[ \\t]+(\\d{1,3})\\b[ \\t]*[:.\\-]?[ \\t]*([^\\n]*)$"));
    PATTERNS.put(
        HeaderKind.SECTION,
        Pattern.compile("(?m)^[ \\t]*(\\d+\\.\\d+)[ \\t]+([A-Z][A-Z0-9 ,'\\-()]{2,})[ \\t]*$"));
    PATTERNS.put(
        HeaderKind.THEOREM,
        Pattern.compile(
            "(?m)^[ \\t]*(?:Theorem|Lemma|Corollary|THEOREM)[ \\t]+(\\d+(?:\\.\\d+)*)"));
    PATTERNS.put(
        HeaderKind.DEFINITION,
        Pattern.compile("(?m)^[ \\t]*(?:Definition|DEFINITION)[ \\t]+(\\d+(?:\\.\\d+)*)"));
    PATTERNS.put(
        HeaderKind.EXERCISE, Pattern.compile("(?im)^[ \\t]*EXERCISE[ \\t]+(\\d+\\.\\d+)"));
    PATTERNS.put(
        HeaderKind.EXAMPLE, Pattern.compile("(?im)^[ \\t]*Example[ \\t]+(\\d+(?:\\.\\d+)?)\\b"));
    PATTERNS.put(
        HeaderKind.MISCELLANEOUS,
        Pattern.compile(
            "(?im)^[ \\t]*MISCELLANEOUS[ \\t]+EXERCISES?"
                + "(?:[ \\t]+ON[ \\t]+CHAPTER[ \\t]+(\\d+))?"));
    PATTERNS.put(HeaderKind.SUMMARY, Pattern.compile("(?im)^[ \\t]*SUMMARY[ \\t]*$"));
  }

  /** All headers in {@code text}, ordered by offset and non-overlapping. */
  public List<HeaderMatch> detect(String text) {
    List<HeaderMatch> found = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return found;
    }
    for (Map.Entry<HeaderKind, Pattern> entry : PATTERNS.entrySet()) {
      Matcher m = entry.getValue().matcher(text);
      while (m.find()) {
        found.add(toMatch(entry.getKey(), m));
      }
    }
    // ties on offset resolve by family declaration order
    found.sort(
        Comparator.comparingInt(HeaderMatch::start)
            .thenComparing(h -> h.kind().ordinal()));

    List<HeaderMatch> headers = new ArrayList<>();
    int lastEnd = -1;
    for (HeaderMatch header : found) {
      if (header.start() >= lastEnd) {
        headers.add(header);
        lastEnd = header.end();
      }
    }
    return headers;
  }

  private static HeaderMatch toMatch(HeaderKind kind, Matcher m) {
    String label = m.groupCount() >= 1 ? m.group(1) : null;
    String title = "";
    if (kind == HeaderKind.CHAPTER || kind == HeaderKind.SECTION) {
      title = m.group(2) == null ? "" : m.group(2).strip();
    }
    if (kind == HeaderKind.CHAPTER && title.isEmpty()) {
      title = "Chapter " + label;
    }
    return new HeaderMatch(kind, m.start(), m.end(), label, title);
  }
}
