package com.aitracker.dedup.service.dedup;

/**
 * Outcome of comparing two headlines.
 *
 * @param score     final score 0-100 (weighted fuzzy average plus any entity boost)
 * @param duplicate whether the two headlines report the same story
 * @param reason    rule that fired, or the veto that blocked a merge; null when nothing applied
 */
public record SimilarityVerdict(double score, boolean duplicate, String reason) {

    public static SimilarityVerdict duplicate(double score, String reason) {
        return new SimilarityVerdict(score, true, reason);
    }

    public static SimilarityVerdict distinct(double score, String reason) {
        return new SimilarityVerdict(score, false, reason);
    }
}
