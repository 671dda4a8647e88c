package com.aitracker.dedup.service;

import com.aitracker.dedup.config.DedupConfig;
import com.aitracker.dedup.dto.BatchResult;
import com.aitracker.dedup.dto.CandidateArticle;
import com.aitracker.dedup.service.dedup.DedupCoordinator;
import com.aitracker.dedup.service.dedup.DedupDecision;
import com.aitracker.dedup.service.dedup.EntityExtractor;
import com.aitracker.dedup.service.dedup.HistoryReader;
import com.aitracker.dedup.service.dedup.SimilarityBreakdown;
import com.aitracker.dedup.service.dedup.SimilarityScorer;
import com.aitracker.dedup.service.dedup.WindowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the ingestion pipeline's deduplication step.
 *
 * Each run gets its own {@link DedupCoordinator} and window store, so nothing seen in one
 * run leaks into another except through the article store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private final DedupConfig dedupConfig;
    private final HistoryReader historyReader;
    private final EntityExtractor entityExtractor;
    private final SimilarityScorer similarityScorer;
    private final Clock clock;

    /**
     * Start a run. History is loaded lazily on the first check.
     */
    public DedupCoordinator openRun() {
        WindowStore windowStore = new WindowStore(historyReader, entityExtractor,
                dedupConfig.getWindowDays(), clock);
        return new DedupCoordinator(windowStore, entityExtractor, similarityScorer);
    }

    /**
     * Deduplicate a batch in input order; an earlier candidate wins over a later duplicate.
     */
    public BatchResult filterBatch(List<CandidateArticle> candidates) {
        DedupCoordinator run = openRun();
        List<CandidateArticle> unique = new ArrayList<>();
        List<BatchResult.Rejection> rejected = new ArrayList<>();

        for (CandidateArticle candidate : candidates) {
            DedupDecision decision = run.check(candidate);
            if (decision.duplicate()) {
                rejected.add(new BatchResult.Rejection(candidate, decision));
            } else {
                unique.add(candidate);
            }
        }

        log.info("Deduplication finished: {} unique, {} duplicates removed", unique.size(), rejected.size());
        return new BatchResult(unique, rejected, run.stats());
    }

    /**
     * Score two headlines with every intermediate signal, for calibrating thresholds.
     */
    public SimilarityBreakdown explain(String title1, String title2) {
        return similarityScorer.explain(title1, entityExtractor.extract(title1),
                title2, entityExtractor.extract(title2));
    }
}
