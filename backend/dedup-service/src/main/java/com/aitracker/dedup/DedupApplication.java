package com.aitracker.dedup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AI Tracker Dedup Service Application
 *
 * Cross-cycle duplicate detection for scraped news articles
 * - URL and normalised-URL identity checks
 * - Multi-algorithm title similarity with entity-based veto rules
 * - Rolling-window comparison against previously stored articles
 */
@SpringBootApplication
public class DedupApplication {

    public static void main(String[] args) {
        SpringApplication.run(DedupApplication.class, args);
    }
}
