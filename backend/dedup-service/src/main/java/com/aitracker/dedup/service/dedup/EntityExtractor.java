package com.aitracker.dedup.service.dedup;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts amounts, organisation tokens and key terms from article text.
 *
 * <p>Amounts are normalised so that differently formatted figures compare equal:</p>
 * <ul>
 *   <li>"₹5,000 crore" → "5000cr"</li>
 *   <li>"Rs 5k" → "5000"</li>
 *   <li>"$100 million" → "100mn"</li>
 * </ul>
 */
@Component
public class EntityExtractor {

    private static final Pattern AMOUNT_PATTERN = Pattern.compile(
            "(?:₹|rs\\.?|inr|usd|\\$)\\s*[\\d,]+(?:\\.\\d+)?\\s*(?:crore|cr|lakh|million|mn|billion|bn|k)?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // CamelCase tech names (SarvamAI, Netsoft, Krutrimcloud) and acronyms (UPC, TCS)
    private static final Pattern COMPANY_PATTERN = Pattern.compile(
            "\\b(?:[A-Z][a-z]+(?:AI|\\.ai|tech|labs?|soft|ware|vision|mind|brain|net|cloud)|[A-Z][A-Z]+)\\b");

    private static final Pattern WORD_PATTERN = Pattern.compile("\\b[a-z]+\\b");
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("[₹$]|rs\\.?|inr|usd");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[\\d.]+");

    public EntitySet extract(String title) {
        return extract(title, null);
    }

    /**
     * Amounts and organisation tokens come from title and content together; key terms
     * come from the title alone since stored articles are compared title to title.
     */
    public EntitySet extract(String title, String content) {
        String safeTitle = title != null ? title : "";
        String fullText = content == null || content.isBlank() ? safeTitle : safeTitle + " " + content;

        Set<String> amounts = new HashSet<>();
        Matcher amountMatcher = AMOUNT_PATTERN.matcher(fullText);
        while (amountMatcher.find()) {
            normalizeAmount(amountMatcher.group()).ifPresent(amounts::add);
        }

        Set<String> companies = new HashSet<>();
        Matcher companyMatcher = COMPANY_PATTERN.matcher(fullText);
        while (companyMatcher.find()) {
            companies.add(companyMatcher.group().toLowerCase(Locale.ROOT));
        }

        Set<String> keyTerms = new HashSet<>();
        Matcher wordMatcher = WORD_PATTERN.matcher(safeTitle.toLowerCase(Locale.ROOT));
        while (wordMatcher.find()) {
            String word = wordMatcher.group();
            if (word.length() > 2 && !DedupVocabulary.NOISE_WORDS.contains(word)) {
                keyTerms.add(word);
            }
        }

        return new EntitySet(amounts, companies, keyTerms);
    }

    /**
     * Normalise one matched amount to {integer}{unit} with unit one of cr, lakh, bn, mn or empty.
     * Returns empty when no number can be read from the fragment.
     */
    Optional<String> normalizeAmount(String raw) {
        String value = raw.toLowerCase(Locale.ROOT).replace(",", "").replaceAll("\\s+", "");
        value = CURRENCY_PATTERN.matcher(value).replaceAll("");

        Matcher number = NUMBER_PATTERN.matcher(value);
        if (!number.find()) {
            return Optional.empty();
        }

        double amount;
        try {
            amount = Double.parseDouble(number.group());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        if (value.contains("k") && !value.contains("crore") && !value.contains("lakh")) {
            amount *= 1000;
        }

        String unit;
        if (value.contains("crore") || value.contains("cr")) {
            unit = "cr";
        } else if (value.contains("lakh")) {
            unit = "lakh";
        } else if (value.contains("billion") || value.contains("bn")) {
            unit = "bn";
        } else if (value.contains("million") || value.contains("mn")) {
            unit = "mn";
        } else {
            unit = "";
        }

        return Optional.of((long) amount + unit);
    }
}
