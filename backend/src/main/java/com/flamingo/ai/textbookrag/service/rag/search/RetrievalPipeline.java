package com.flamingo.ai.textbookrag.service.rag.search;

import com.flamingo.ai.textbookrag.config.RagConfig;
import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.ChunkFilter;
import com.flamingo.ai.textbookrag.service.rag.model.ContentType;
import com.flamingo.ai.textbookrag.service.rag.model.QueryClassification;
import com.flamingo.ai.textbookrag.service.rag.model.QueryIntent;
import com.flamingo.ai.textbookrag.service.rag.model.RetrievalResult;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifier-driven search on top of {@link HybridRetriever}.
 *
 * <ul>
 *   <li>Example ranges: a few exact matches per number, concatenated and cut to {@code k}; general
 *       retrieval when none match.
 *   <li>A single example number: exact match, or general retrieval when the example is not
 *       indexed.
 *   <li>Definition, theorem, formula and example questions without a number: retrieval restricted
 *       to that content type, topped up with general results when it yields fewer than {@code
 *       k/2}.
 *   <li>Everything else: general retrieval.
 * </ul>
 *
 * <p>Caller filters apply to every path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalPipeline {

  private static final Set<QueryIntent> TYPED_INTENTS =
      Set.of(QueryIntent.DEFINITION, QueryIntent.THEOREM, QueryIntent.FORMULA, QueryIntent.EXAMPLE);

  private final HybridRetriever hybridRetriever;
  private final QueryClassifier queryClassifier;
  private final RagConfig ragConfig;

  @Timed(value = "rag.search", description = "Time for classifier-driven search")
  public List<RetrievalResult> search(String query, int k, ChunkFilter filter) {
    ChunkFilter filters = ChunkFilter.orNone(filter);
    QueryClassification classification = queryClassifier.classify(query);
    log.info("Query intent {} (entity={})", classification.intent(), classification.entityQuery());
    if (k <= 0) {
      return List.of();
    }

    if (classification.intent() == QueryIntent.EXAMPLE) {
      if (classification.hasExampleRange()) {
        List<RetrievalResult> range = searchExampleRange(query, classification, k, filters);
        if (!range.isEmpty()) {
          return range;
        }
        log.info(
            "No examples in range {} indexed, using general retrieval",
            classification.exampleRange());
        return hybridRetriever.retrieve(query, k, filters);
      }
      if (classification.exampleNumber() != null) {
        String number = classification.exampleNumber();
        List<RetrievalResult> exact = hybridRetriever.retrieveByExample(query, number, k, filters);
        if (!exact.isEmpty()) {
          return exact;
        }
        log.info("Example {} not found by metadata, using general retrieval", number);
        return hybridRetriever.retrieve(query, k, filters);
      }
    }

    if (TYPED_INTENTS.contains(classification.intent())) {
      ContentType type = classification.intent().contentType().orElseThrow();
      List<RetrievalResult> results =
          new ArrayList<>(hybridRetriever.retrieveByType(query, type, k, filters));
      if (results.size() < k / 2) {
        log.debug("Only {} {} results, adding general results", results.size(), type.value());
        Set<String> seen = new HashSet<>();
        results.forEach(r -> seen.add(r.chunk().chunkId()));
        for (RetrievalResult general : hybridRetriever.retrieve(query, k, filters)) {
          if (results.size() >= k) {
            break;
          }
          if (seen.add(general.chunk().chunkId())) {
            results.add(general);
          }
        }
      }
      return renumber(results);
    }

    return hybridRetriever.retrieve(query, k, filters);
  }

  /**
   * Renders results as a context block for answer generation, one source per result.
   *
   * @param results retrieval results in rank order
   * @return the context text, empty when there are no results
   */
  public String formatForContext(List<RetrievalResult> results) {
    if (results.isEmpty()) {
      return "";
    }

    StringBuilder context = new StringBuilder();
    context.append("=== TEXTBOOK CONTEXT ===\n\n");
    for (RetrievalResult result : results) {
      Chunk chunk = result.chunk();
      context.append(
          String.format(
              Locale.ROOT,
              "[Source %d: page %d, score %.4f",
              result.rank(),
              chunk.pageNumber(),
              result.score()));
      if (chunk.label() != null) {
        context.append(", ").append(chunk.contentType().value()).append(' ').append(chunk.label());
      }
      context.append("]\n");
      context.append(chunk.fullContext());
      context.append("\n\n");
    }
    context.append("=== END TEXTBOOK CONTEXT ===");
    return context.toString();
  }

  private List<RetrievalResult> searchExampleRange(
      String query, QueryClassification classification, int k, ChunkFilter filters) {
    int perNumber = ragConfig.getRetrieval().getPerNumberTopK();
    List<RetrievalResult> results = new ArrayList<>();
    for (String number : classification.exampleRange()) {
      results.addAll(hybridRetriever.retrieveByExample(query, number, perNumber, filters));
      if (results.size() >= k) {
        break;
      }
    }
    return renumber(results.size() > k ? results.subList(0, k) : results);
  }

  private static List<RetrievalResult> renumber(List<RetrievalResult> results) {
    List<RetrievalResult> ranked = new ArrayList<>(results.size());
    for (RetrievalResult result : results) {
      ranked.add(new RetrievalResult(result.chunk(), result.score(), ranked.size() + 1));
    }
    return ranked;
  }
}
