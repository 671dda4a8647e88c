package com.aitracker.dedup.service.dedup;

import com.aitracker.dedup.dto.CandidateArticle;
import com.aitracker.dedup.dto.DedupStatsDTO;
import com.aitracker.dedup.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Duplicate check for the candidates of one run.
 *
 * <p>Checks run cheapest first and stop at the first match:</p>
 * <ol>
 *   <li>exact URL seen in history or this run</li>
 *   <li>normalised URL seen in history or this run</li>
 *   <li>title similarity against stored articles in the rolling window</li>
 *   <li>title similarity against articles accepted earlier in this run</li>
 * </ol>
 * <p>A candidate that passes all four is recorded in the {@link WindowStore} so later
 * candidates are compared against it. Instances are per run and not thread-safe.</p>
 */
@Slf4j
public class DedupCoordinator {

    private static final int LOG_TITLE_LENGTH = 60;

    private final WindowStore windowStore;
    private final EntityExtractor entityExtractor;
    private final SimilarityScorer similarityScorer;

    public DedupCoordinator(WindowStore windowStore, EntityExtractor entityExtractor,
                            SimilarityScorer similarityScorer) {
        this.windowStore = windowStore;
        this.entityExtractor = entityExtractor;
        this.similarityScorer = similarityScorer;
    }

    public boolean isDuplicate(CandidateArticle candidate) {
        return check(candidate).duplicate();
    }

    public DedupDecision check(CandidateArticle candidate) {
        String url = candidate.url();
        String title = candidate.title();

        if (windowStore.lookupExact(url)) {
            log.debug("Exact URL duplicate: {}", truncate(title));
            return DedupDecision.urlMatch(DedupStage.EXACT_URL, url);
        }

        // malformed urls normalise to nothing and are only compared by title
        String normalizedUrl = UrlNormalizer.normalize(url);
        if (!normalizedUrl.isEmpty() && windowStore.lookupNormalized(normalizedUrl)) {
            log.debug("Normalized URL duplicate: {}", truncate(title));
            return DedupDecision.urlMatch(DedupStage.NORMALIZED_URL, normalizedUrl);
        }

        EntitySet entities = entityExtractor.extract(title, candidate.content());

        DedupDecision crossCycle = findSimilar(DedupStage.CROSS_CYCLE, title, entities);
        if (crossCycle != null) {
            return crossCycle;
        }

        DedupDecision inCycle = findSimilar(DedupStage.IN_CYCLE, title, entities);
        if (inCycle != null) {
            return inCycle;
        }

        windowStore.record(candidate, entities);
        return DedupDecision.accepted();
    }

    public DedupStatsDTO stats() {
        return windowStore.stats();
    }

    private DedupDecision findSimilar(DedupStage stage, String title, EntitySet entities) {
        Iterable<SeenArticle> existing = stage == DedupStage.CROSS_CYCLE
                ? windowStore.scanHistory()
                : windowStore.scanCycle();

        for (SeenArticle seen : existing) {
            SimilarityVerdict verdict = similarityScorer.score(title, entities, seen.title(), seen.entities());
            if (verdict.duplicate()) {
                log.info("{} duplicate detected (score {}): new='{}' existing='{}' reason='{}'",
                        stage.getLabel(), String.format("%.1f", verdict.score()),
                        truncate(title), truncate(seen.title()), verdict.reason());
                return DedupDecision.similarTo(stage, seen, verdict);
            }
        }
        return null;
    }

    private static String truncate(String title) {
        if (title == null || title.length() <= LOG_TITLE_LENGTH) {
            return title;
        }
        return title.substring(0, LOG_TITLE_LENGTH) + "...";
    }
}
