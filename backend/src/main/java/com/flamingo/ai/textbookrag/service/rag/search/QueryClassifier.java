package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.QueryClassification;
import com.flamingo.ai.textbookrag.service.rag.model.QueryIntent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps a query to an intent and pulls out the numbered items it names.
 *
 * <p>An explicit example number or range makes the query an {@link QueryIntent#EXAMPLE} query, and
 * an exercise, question or problem number makes it an {@link QueryIntent#EXERCISE} query.
 * Otherwise keyword families are tried in a fixed order and {@link QueryIntent#CONCEPT} is the
 * default.
 */
@Component
@RequiredArgsConstructor
public class QueryClassifier {

  private static final Map<QueryIntent, Pattern> KEYWORD_FAMILIES = new LinkedHashMap<>();

  static {
    KEYWORD_FAMILIES.put(
        QueryIntent.DEFINITION, keywords("what is", "define", "meaning of", "definition"));
    KEYWORD_FAMILIES.put(QueryIntent.THEOREM, keywords("theorem", "prove", "proof"));
    KEYWORD_FAMILIES.put(QueryIntent.FORMULA, keywords("formula", "equation", "expression"));
    KEYWORD_FAMILIES.put(QueryIntent.EXAMPLE, keywords("example", "demonstrate", "illustrate"));
    KEYWORD_FAMILIES.put(
        QueryIntent.EXERCISE, keywords("solve", "exercise", "problem", "question"));
    KEYWORD_FAMILIES.put(QueryIntent.CONCEPT, keywords("explain", "how", "why", "concept"));
  }

  private static final Pattern EXAMPLE_RANGE =
      Pattern.compile(
          "\\bexamples?\\s+(\\d{1,6})\\s*(?:to|-)\\s*(\\d{1,6})\\b", Pattern.CASE_INSENSITIVE);

  private static final List<Pattern> EXAMPLE_NUMBER =
      List.of(
          Pattern.compile("\\bexample\\s+(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bex\\.\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE));

  private static final Pattern EXERCISE_NUMBER =
      Pattern.compile(
          "\\b(?:exercise|question|problem|q\\.?)\\s*(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE);

  private static final Pattern ENTITY =
      Pattern.compile(
          "\\b(?:examples?|ex|exercise|question|q|problem)\\.?\\s*\\d+", Pattern.CASE_INSENSITIVE);

  private final RagConfig ragConfig;

  public QueryClassification classify(String query) {
    String text = query == null ? "" : query;
    List<String> range = extractExampleRange(text);
    String exampleNumber = extractExampleNumber(text);
    boolean entity = isEntityQuery(text);

    if (!range.isEmpty() || exampleNumber != null) {
      return new QueryClassification(QueryIntent.EXAMPLE, exampleNumber, range, null, entity);
    }
    String exerciseNumber = extractExerciseNumber(text);
    if (exerciseNumber != null) {
      return new QueryClassification(
          QueryIntent.EXERCISE, null, List.of(), exerciseNumber, entity);
    }
    for (Map.Entry<QueryIntent, Pattern> family : KEYWORD_FAMILIES.entrySet()) {
      if (family.getValue().matcher(text).find()) {
        return new QueryClassification(family.getKey(), null, List.of(), null, entity);
      }
    }
    return new QueryClassification(QueryIntent.CONCEPT, null, List.of(), null, entity);
  }

  /** Whether the query names a specific numbered example, exercise, question or problem. */
  public boolean isEntityQuery(String query) {
    return query != null && ENTITY.matcher(query).find();
  }

  /**
   * Expands "examples 2 to 5" or "examples 2-5" into its numbers. Reversed bounds are swapped and
   * the span is clamped to {@code rag.retrieval.range-cap}.
   *
   * @return the example numbers, empty when the query names no range
   */
  public List<String> extractExampleRange(String query) {
    Matcher m = EXAMPLE_RANGE.matcher(query);
    if (!m.find()) {
      return List.of();
    }
    int start = Integer.parseInt(m.group(1));
    int end = Integer.parseInt(m.group(2));
    if (end < start) {
      int swap = start;
      start = end;
      end = swap;
    }
    int cap = ragConfig.getRetrieval().getRangeCap();
    if (end - start > cap) {
      end = start + cap;
    }
    List<String> numbers = new ArrayList<>();
    for (int i = start; i <= end; i++) {
      numbers.add(String.valueOf(i));
    }
    return numbers;
  }

  public String extractExampleNumber(String query) {
    for (Pattern pattern : EXAMPLE_NUMBER) {
      Matcher m = pattern.matcher(query);
      if (m.find()) {
        return m.group(1);
      }
    }
    return null;
  }

  public String extractExerciseNumber(String query) {
    Matcher m = EXERCISE_NUMBER.matcher(query);
    return m.find() ? m.group(1) : null;
  }

  private static Pattern keywords(String... words) {
    return Pattern.compile(
        "\\b(?:" + String.join("|", words) + ")\\b", Pattern.CASE_INSENSITIVE);
  }
}
