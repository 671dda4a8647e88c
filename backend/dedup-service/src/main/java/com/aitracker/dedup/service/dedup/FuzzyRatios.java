package com.aitracker.dedup.service.dedup;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Fuzzy string ratios on a 0-100 integer scale.
 *
 * <p>{@link #ratio} is the indel similarity 2·LCS/(|a|+|b|). The token variants compare a
 * processed form of each string (lower-cased, non-alphanumerics replaced by spaces).</p>
 */
public final class FuzzyRatios {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private FuzzyRatios() {}

    /** Character-level similarity of the two strings as given. */
    public static int ratio(String s1, String s2) {
        if (s1.equals(s2)) {
            return 100;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }
        int common = LCS.apply(s1, s2);
        return (int) Math.round(200.0 * common / (s1.length() + s2.length()));
    }

    /**
     * Best {@link #ratio} of the shorter string against every window of the same length
     * in the longer one. Windows that start near the end of the longer string are cut short
     * there, so a headline that overlaps another only at its tail still scores.
     */
    public static int partialRatio(String s1, String s2) {
        if (s1.equals(s2)) {
            return 100;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }
        boolean firstShorter = s1.length() <= s2.length();
        String shorter = firstShorter ? s1 : s2;
        String longer = firstShorter ? s2 : s1;
        int window = shorter.length();

        double best = 0;
        for (int offset = 0; offset < longer.length() && best < 1.0; offset++) {
            String slice = longer.substring(offset, Math.min(offset + window, longer.length()));
            best = Math.max(best, 2.0 * LCS.apply(shorter, slice) / (window + slice.length()));
        }
        return (int) Math.round(100.0 * best);
    }

    /** Ratio after sorting each string's words. */
    public static int tokenSortRatio(String s1, String s2) {
        String p1 = process(s1);
        String p2 = process(s2);
        if (p1.isEmpty() || p2.isEmpty()) {
            return 0;
        }
        return ratio(sortedTokens(p1), sortedTokens(p2));
    }

    /**
     * Compares the shared words against each side's shared-plus-remaining words,
     * so a headline that only adds words to another still scores high.
     */
    public static int tokenSetRatio(String s1, String s2) {
        String p1 = process(s1);
        String p2 = process(s2);
        if (p1.isEmpty() || p2.isEmpty()) {
            return 0;
        }
        TreeSet<String> tokens1 = new TreeSet<>(Arrays.asList(p1.split(" ")));
        TreeSet<String> tokens2 = new TreeSet<>(Arrays.asList(p2.split(" ")));

        TreeSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        TreeSet<String> only1 = new TreeSet<>(tokens1);
        only1.removeAll(tokens2);
        TreeSet<String> only2 = new TreeSet<>(tokens2);
        only2.removeAll(tokens1);

        String sorted = String.join(" ", intersection);
        String combined1 = (sorted + " " + String.join(" ", only1)).trim();
        String combined2 = (sorted + " " + String.join(" ", only2)).trim();

        return Math.max(ratio(sorted, combined1),
                Math.max(ratio(sorted, combined2), ratio(combined1, combined2)));
    }

    static String process(String s) {
        if (s == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String sortedTokens(String processed) {
        String[] tokens = processed.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
