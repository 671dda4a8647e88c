package com.aitracker.dedup.service.dedup;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether two sets of normalised amounts could describe the same figure.
 *
 * <p>"5000cr" and "5000" compare equal (unit formatting differs), "10mn" and "50mn" do not.
 * When either side has nothing parseable the sets count as similar.</p>
 */
public class AmountSimilarity {

    private static final Pattern LEADING_INTEGER = Pattern.compile("\\d+");
    private static final int MAX_DIGITS = 18;

    private final double toleranceRatio;

    public AmountSimilarity(double toleranceRatio) {
        this.toleranceRatio = toleranceRatio;
    }

    public boolean similar(Set<String> amounts1, Set<String> amounts2) {
        Set<Long> nums1 = leadingNumbers(amounts1);
        Set<Long> nums2 = leadingNumbers(amounts2);

        if (nums1.isEmpty() || nums2.isEmpty()) {
            return true;
        }

        for (Long n1 : nums1) {
            if (nums2.contains(n1)) {
                return true;
            }
        }

        // rounded figures: "4,950 crore" vs "5,000 crore"
        for (long n1 : nums1) {
            for (long n2 : nums2) {
                double ratio = (double) Math.min(n1, n2) / Math.max(n1, n2);
                if (ratio > toleranceRatio) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Set<Long> leadingNumbers(Set<String> amounts) {
        Set<Long> numbers = new HashSet<>();
        if (amounts == null) {
            return numbers;
        }
        for (String amount : amounts) {
            Matcher matcher = LEADING_INTEGER.matcher(amount);
            if (!matcher.find()) {
                continue;
            }
            String digits = matcher.group();
            if (digits.length() > MAX_DIGITS) {
                continue;
            }
            long value = Long.parseLong(digits);
            if (value > 0) {
                numbers.add(value);
            }
        }
        return numbers;
    }
}
