package com.aitracker.dedup.service.dedup;

import java.util.Set;

/**
 * Word lists used by entity extraction and the distinguishing-term check.
 * English and Indian-market specific.
 */
final class DedupVocabulary {

    /** Stop words plus reporting phrases that say nothing about the event itself */
    static final Set<String> NOISE_WORDS = Set.of(
            "a", "an", "the", "to", "for", "in", "on", "at", "by", "with", "from",
            "is", "are", "was", "were", "be", "been", "being",
            "will", "would", "could", "should", "may", "might",
            "set", "up", "sets", "setting", "ready", "new",
            "india", "indian", "indias",
            "announces", "announced", "announcement", "launching", "launches", "launch",
            "plans", "planning", "planned", "plan",
            "estimated", "expected", "likely", "reportedly",
            "says", "said", "reports", "reported"
    );

    /** Frequent in the topic's headlines, so never evidence of a different subject */
    static final Set<String> GENERIC_TERMS = Set.of(
            "india", "indian", "startup", "company", "funding", "raises",
            "million", "crore", "series", "round", "investment", "launches",
            "announces", "plans", "model", "platform", "technology", "digital",
            "artificial", "intelligence", "machine", "learning", "data",
            "centre", "center", "global", "first", "latest", "biggest",
            "healthcare", "health", "care", "sector", "industry"
    );

    /** Major companies; a mismatch on these always means a different story */
    static final Set<String> KNOWN_COMPANIES = Set.of(
            "google", "microsoft", "amazon", "meta", "facebook", "apple",
            "nvidia", "openai", "anthropic", "ibm", "oracle", "salesforce",
            "infosys", "tcs", "wipro", "hcl", "cognizant",
            "reliance", "tata", "adani", "airtel", "jio", "paytm", "flipkart",
            "zomato", "swiggy", "ola", "uber", "byju", "unacademy"
    );

    private DedupVocabulary() {}
}
