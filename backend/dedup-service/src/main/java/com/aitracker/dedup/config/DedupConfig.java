package com.aitracker.dedup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for duplicate detection thresholds and the rolling history window.
 *
 * Threshold values are 0-100 fuzzy-ratio percentages and were tuned against
 * Indian AI-policy and funding headlines:
 * - token-set >= 88 with basic >= 70 : reworded headline of the same story
 * - partial >= 90 with token-sort >= 80 : one headline contains the other
 * - combined + margin (87) with entity evidence : same amounts or strong term overlap
 */
@Configuration
@ConfigurationProperties(prefix = "dedup")
@Data
public class DedupConfig {

    /** Days of stored articles compared against on each run */
    private int windowDays = 14;

    private int tokenSetThreshold = 88;

    /** Basic ratio required next to a high token-set ratio when no entity evidence exists */
    private int basicRatioFloor = 70;

    private int partialThreshold = 90;

    private int tokenSortFloor = 80;

    private int combinedThreshold = 82;

    /** Added to combinedThreshold for the entity-confirmed rule */
    private int combinedMargin = 5;

    /** Two amounts within this min/max ratio are treated as the same figure */
    private double amountToleranceRatio = 0.8;

    private int amountBoost = 8;

    private double termOverlapMinRatio = 0.5;

    private int termOverlapMaxBoost = 15;

    /** Distinguishing-term overlap below this vetoes a merge */
    private double distinguishingMinOverlap = 0.3;

    private Weights weights = new Weights();

    @Data
    public static class Weights {
        private double tokenSet = 0.40;
        private double partial = 0.25;
        private double tokenSort = 0.25;
        private double basic = 0.10;
    }

    public int entityConfirmedThreshold() {
        return combinedThreshold + combinedMargin;
    }
}
