package com.aitracker.dedup.dto;

import com.aitracker.dedup.service.dedup.DedupDecision;

import java.util.List;

/**
 * Outcome of deduplicating one ordered batch of candidates.
 *
 * @param unique   candidates accepted, in input order
 * @param rejected duplicates with the decision that rejected them, in input order
 * @param stats    window store statistics at the end of the batch
 */
public record BatchResult(
        List<CandidateArticle> unique,
        List<Rejection> rejected,
        DedupStatsDTO stats
) {
    public int duplicatesRemoved() {
        return rejected.size();
    }

    public record Rejection(CandidateArticle candidate, DedupDecision decision) {}
}
