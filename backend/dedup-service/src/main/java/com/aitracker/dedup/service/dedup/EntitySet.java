package com.aitracker.dedup.service.dedup;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entities pulled from a headline (and optional body) for comparison.
 *
 * @param amounts   normalised monetary magnitudes, e.g. "5000cr", "10mn"
 * @param companies lower-cased organisation-like tokens
 * @param keyTerms  lower-cased words left after stop/noise word removal
 */
public record EntitySet(Set<String> amounts, Set<String> companies, Set<String> keyTerms) {

    public static final EntitySet EMPTY = new EntitySet(Set.of(), Set.of(), Set.of());

    public EntitySet {
        amounts = sortedCopy(amounts);
        companies = sortedCopy(companies);
        keyTerms = sortedCopy(keyTerms);
    }

    public boolean hasAmounts() {
        return !amounts.isEmpty();
    }

    public boolean hasKeyTerms() {
        return !keyTerms.isEmpty();
    }

    private static Set<String> sortedCopy(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
