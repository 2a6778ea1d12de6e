package com.flamingo.ai.textbookrag.service.rag.linking;

import com.flamingo.ai.textbookrag.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.textbookrag.service.rag.model.MediaKind;
import com.flamingo.ai.textbookrag.service.rag.model.PageMedia;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Attaches images and tables to the drafts of one buffer.
 *
 * <p>Linking runs in two phases over the whole group. First, every draft's text is scanned for
 * citations such as {@code "Fig 1.1"} or {@code "Table 2.1"} and the cited media is attached.
 * Then the media nobody cited is handed to the configured {@link OrphanRescueStrategy}; orphans it
 * cannot place are dropped and reported. A draft never holds the same item twice.
 */
@Slf4j
@Component
public class ReferenceLinker {

  private static final Pattern CITATION =
      Pattern.compile(
          "\\b(Fig(?:ure)?s?\\.?|Table)\\s*(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE);

  private static final Pattern MEDIA_ID =
      Pattern.compile(
          "^(?:fig(?:ure)?|tab(?:le)?)[_\\-. ]*(\\d+(?:[_\\-.]\\d+)*)$", Pattern.CASE_INSENSITIVE);

  private final OrphanRescueStrategy orphanRescueStrategy;
  private final Counter droppedOrphans;

  public ReferenceLinker(OrphanRescueStrategy orphanRescueStrategy, MeterRegistry meterRegistry) {
    this.orphanRescueStrategy = orphanRescueStrategy;
    this.droppedOrphans =
        Counter.builder("chunking.orphans.dropped")
            .description("Media that no chunk cited or shared a page with")
            .register(meterRegistry);
    log.info("Orphan media placement: {}", orphanRescueStrategy.getStrategyName());
  }

  /** Runs both phases. */
  public void link(
      List<ChunkDraft> group,
      Collection<? extends PageMedia> pool,
      Map<Integer, PageRecord> pages) {
    List<PageMedia> orphans = linkExplicit(group, pool);
    rescueOrphans(group, orphans, pages);
  }

  /**
   * Phase 1: attaches every cited item to the drafts that cite it.
   *
   * @return the pool items no draft cited, in pool order
   */
  public List<PageMedia> linkExplicit(
      List<ChunkDraft> group, Collection<? extends PageMedia> pool) {
    Set<PageMedia> claimed = new LinkedHashSet<>();
    for (ChunkDraft draft : group) {
      for (Citation citation : citations(draft.getText())) {
        for (PageMedia item : pool) {
          if (item.kind() == citation.kind()
              && numbers(item).contains(citation.number())
              && (draft.attach(item) || draft.holds(item))) {
            claimed.add(item);
          }
        }
      }
    }
    List<PageMedia> orphans = new ArrayList<>();
    for (PageMedia item : pool) {
      if (!claimed.contains(item)) {
        orphans.add(item);
      }
    }
    return orphans;
  }

  /** Phase 2: places orphans with the configured strategy; unplaceable ones are dropped. */
  public void rescueOrphans(
      List<ChunkDraft> group, List<PageMedia> orphans, Map<Integer, PageRecord> pages) {
    if (orphans.isEmpty()) {
      return;
    }
    Map<PageMedia, List<ChunkDraft>> placement = orphanRescueStrategy.place(group, orphans, pages);
    for (PageMedia orphan : orphans) {
      boolean placed = false;
      for (ChunkDraft draft : placement.getOrDefault(orphan, List.of())) {
        placed |= draft.attach(orphan) || draft.holds(orphan);
      }
      if (!placed) {
        droppedOrphans.increment();
        log.warn(
            "Dropped orphan {} {} on page {}: no co-located chunk",
            orphan.kind().name().toLowerCase(Locale.ROOT),
            orphan.id(),
            orphan.pageNumber());
      }
    }
  }

  /** A figure or table citation found in text. */
  record Citation(MediaKind kind, String number) {}

  static List<Citation> citations(String text) {
    List<Citation> citations = new ArrayList<>();
    Matcher m = CITATION.matcher(text);
    while (m.find()) {
      MediaKind kind =
          m.group(1).toLowerCase(Locale.ROOT).startsWith("fig") ? MediaKind.IMAGE : MediaKind.TABLE;
      Citation citation = new Citation(kind, normalize(m.group(2)));
      if (!citations.contains(citation)) {
        citations.add(citation);
      }
    }
    return citations;
  }

  /** Numbers an item answers to, from its identifier and its caption. */
  static Set<String> numbers(PageMedia item) {
    Set<String> numbers = new LinkedHashSet<>();
    if (item.id() != null) {
      Matcher id = MEDIA_ID.matcher(item.id().strip());
      if (id.matches()) {
        numbers.add(normalize(id.group(1).replaceAll("[_\\-]", ".")));
      }
    }
    Matcher caption = CITATION.matcher(item.caption());
    if (caption.find()) {
      numbers.add(normalize(caption.group(2)));
    }
    return numbers;
  }

  private static String normalize(String number) {
    String normalized = number.strip();
    while (normalized.endsWith(".")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }
}
