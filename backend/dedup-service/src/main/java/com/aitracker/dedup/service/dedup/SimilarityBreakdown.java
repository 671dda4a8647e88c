package com.aitracker.dedup.service.dedup;

import java.util.Set;

/**
 * Every intermediate signal behind a {@link SimilarityVerdict}, for threshold tuning and logs.
 * Distinguishing terms are empty when the amount check vetoed before they were computed.
 */
public record SimilarityBreakdown(
        String title1,
        String title2,
        int tokenSet,
        int partial,
        int tokenSort,
        int basic,
        double weightedAverage,
        EntitySet entities1,
        EntitySet entities2,
        Set<String> distinguishing1,
        Set<String> distinguishing2,
        SimilarityVerdict verdict
) {
}
