package com.aitracker.dedup.service.dedup;

import com.aitracker.dedup.dto.CandidateArticle;
import com.aitracker.dedup.dto.DedupStatsDTO;
import com.aitracker.dedup.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Articles known to one run, in two scopes.
 *
 * <ul>
 *   <li>history: articles stored within the rolling window, loaded from the
 *       {@link HistoryReader} once, on first use, and read-only afterwards</li>
 *   <li>cycle: articles accepted so far in this run</li>
 * </ul>
 *
 * <p>A failed history load is logged and the run continues with no history; it is not
 * retried. Not thread-safe: candidates must be checked one at a time.</p>
 */
@Slf4j
public class WindowStore {

    private final HistoryReader historyReader;
    private final EntityExtractor entityExtractor;
    private final int windowDays;
    private final Clock clock;

    private final Set<String> historyUrls = new HashSet<>();
    private final Set<String> historyNormalizedUrls = new HashSet<>();
    private final List<SeenArticle> history = new ArrayList<>();

    private final Set<String> cycleUrls = new HashSet<>();
    private final Set<String> cycleNormalizedUrls = new HashSet<>();
    private final List<SeenArticle> cycle = new ArrayList<>();

    private boolean historyLoaded;

    public WindowStore(HistoryReader historyReader, EntityExtractor entityExtractor, int windowDays, Clock clock) {
        this.historyReader = historyReader;
        this.entityExtractor = entityExtractor;
        this.windowDays = windowDays;
        this.clock = clock;
    }

    public boolean lookupExact(String url) {
        ensureHistoryLoaded();
        return cycleUrls.contains(url) || historyUrls.contains(url);
    }

    public boolean lookupNormalized(String normalizedUrl) {
        ensureHistoryLoaded();
        return cycleNormalizedUrls.contains(normalizedUrl) || historyNormalizedUrls.contains(normalizedUrl);
    }

    public List<SeenArticle> scanHistory() {
        ensureHistoryLoaded();
        return Collections.unmodifiableList(history);
    }

    public List<SeenArticle> scanCycle() {
        return Collections.unmodifiableList(cycle);
    }

    /**
     * Remember an accepted article for the rest of the run.
     */
    public void record(CandidateArticle article, EntitySet entities) {
        cycleUrls.add(article.url());
        addNormalized(cycleNormalizedUrls, article.url());
        LocalDateTime date = article.publishDate() != null
                ? article.publishDate().atStartOfDay()
                : LocalDateTime.now(clock);
        cycle.add(new SeenArticle(article.title(), article.url(), date, entities));
    }

    /**
     * Earliest storage timestamp still inside the rolling window.
     */
    public LocalDateTime windowCutoff() {
        return LocalDateTime.now(clock).minusDays(windowDays);
    }

    public DedupStatsDTO stats() {
        Set<String> urls = new HashSet<>(historyUrls);
        urls.addAll(cycleUrls);
        return new DedupStatsDTO(urls.size(), cycle.size(), history.size(), historyLoaded);
    }

    private void ensureHistoryLoaded() {
        if (historyLoaded) {
            return;
        }
        historyLoaded = true;

        LocalDateTime cutoff = windowCutoff();
        List<HistoryRecord> records;
        try {
            records = historyReader.findStoredSince(cutoff);
        } catch (RuntimeException e) {
            log.warn("Could not load stored titles, continuing without history: {}", e.getMessage(), e);
            return;
        }

        for (HistoryRecord stored : records) {
            // inclusive edge: stored exactly at the cutoff is still in the window
            if (stored.storedAt() == null || stored.storedAt().isBefore(cutoff)) {
                continue;
            }
            history.add(new SeenArticle(stored.title(), stored.url(), stored.storedAt(),
                    entityExtractor.extract(stored.title())));
            if (stored.url() != null) {
                historyUrls.add(stored.url());
                addNormalized(historyNormalizedUrls, stored.url());
            }
        }

        log.info("Loaded {} titles from history (rolling window: last {} days, from {})",
                history.size(), windowDays, cutoff.toLocalDate());
    }

    private static void addNormalized(Set<String> target, String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }
}
