package com.aitracker.dedup.service.dedup;

/**
 * Verdict for one candidate. Score, matched title and matched URL are only set for
 * similarity-based rejections.
 */
public record DedupDecision(
        boolean duplicate,
        DedupStage stage,
        String reason,
        Double score,
        String matchedTitle,
        String matchedUrl
) {
    public static DedupDecision accepted() {
        return new DedupDecision(false, DedupStage.UNIQUE, null, null, null, null);
    }

    public static DedupDecision urlMatch(DedupStage stage, String url) {
        return new DedupDecision(true, stage, stage.getLabel() + " match: " + url, null, null, url);
    }

    public static DedupDecision similarTo(DedupStage stage, SeenArticle existing, SimilarityVerdict verdict) {
        return new DedupDecision(true, stage, verdict.reason(), verdict.score(), existing.title(), existing.url());
    }
}
