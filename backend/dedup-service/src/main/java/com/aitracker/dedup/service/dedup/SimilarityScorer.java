package com.aitracker.dedup.service.dedup;

import com.aitracker.dedup.config.DedupConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Headline similarity with anti-false-merge rules.
 *
 * <p>Four fuzzy ratios are combined into a weighted average. Before any match is accepted two
 * vetoes run, because news templates reuse the same wording for different events:</p>
 * <ul>
 *   <li>"Startup X raises $10M in Series A" vs "Startup X raises $50M in Series B":
 *       amounts differ beyond rounding, so these are different rounds</li>
 *   <li>"Google launches AI for healthcare" vs "Microsoft launches AI for healthcare":
 *       distinguishing terms barely overlap, so these are different subjects</li>
 * </ul>
 * <p>Only then do entity signals (matching amounts, key-term overlap) boost the score, and
 * the classification rules decide.</p>
 */
@Component
@Slf4j
public class SimilarityScorer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]");

    private final DedupConfig config;
    private final AmountSimilarity amountSimilarity;

    public SimilarityScorer(DedupConfig config) {
        this.config = config;
        this.amountSimilarity = new AmountSimilarity(config.getAmountToleranceRatio());
    }

    public SimilarityVerdict score(String title1, EntitySet entities1, String title2, EntitySet entities2) {
        return explain(title1, entities1, title2, entities2).verdict();
    }

    public boolean amountsSimilar(Set<String> amounts1, Set<String> amounts2) {
        return amountSimilarity.similar(amounts1, amounts2);
    }

    public SimilarityBreakdown explain(String title1, EntitySet entities1, String title2, EntitySet entities2) {
        String raw1 = Objects.toString(title1, "");
        String raw2 = Objects.toString(title2, "");
        EntitySet e1 = entities1 != null ? entities1 : EntitySet.EMPTY;
        EntitySet e2 = entities2 != null ? entities2 : EntitySet.EMPTY;
        String t1 = raw1.toLowerCase(Locale.ROOT);
        String t2 = raw2.toLowerCase(Locale.ROOT);

        int tokenSet = FuzzyRatios.tokenSetRatio(t1, t2);
        int partial = FuzzyRatios.partialRatio(t1, t2);
        int tokenSort = FuzzyRatios.tokenSortRatio(t1, t2);
        int basic = FuzzyRatios.ratio(t1, t2);

        DedupConfig.Weights weights = config.getWeights();
        double weightedAvg = tokenSet * weights.getTokenSet()
                + partial * weights.getPartial()
                + tokenSort * weights.getTokenSort()
                + basic * weights.getBasic();

        // Vetoes first: similar wording must not merge different events
        if (e1.hasAmounts() && e2.hasAmounts()
                && !e1.amounts().equals(e2.amounts())
                && !amountSimilarity.similar(e1.amounts(), e2.amounts())) {
            String veto = "Different amounts " + e1.amounts() + " vs " + e2.amounts();
            log.debug("{}: '{}' / '{}'", veto, raw1, raw2);
            return new SimilarityBreakdown(raw1, raw2, tokenSet, partial, tokenSort, basic, weightedAvg,
                    e1, e2, Set.of(), Set.of(), SimilarityVerdict.distinct(weightedAvg, veto));
        }

        Set<String> key1 = distinguishingTerms(raw1, e1);
        Set<String> key2 = distinguishingTerms(raw2, e2);
        if (!key1.isEmpty() && !key2.isEmpty()) {
            Set<String> all = new TreeSet<>(key1);
            all.addAll(key2);
            Set<String> common = new TreeSet<>(key1);
            common.retainAll(key2);

            if (all.size() >= 2) {
                double overlap = (double) common.size() / all.size();
                if (overlap < config.getDistinguishingMinOverlap()) {
                    String veto = String.format(Locale.ROOT, "Different subjects (distinguishing overlap %.0f%%)",
                            overlap * 100);
                    log.debug("{}: '{}' / '{}'", veto, raw1, raw2);
                    return new SimilarityBreakdown(raw1, raw2, tokenSet, partial, tokenSort, basic, weightedAvg,
                            e1, e2, key1, key2, SimilarityVerdict.distinct(weightedAvg, veto));
                }
            }
        }

        int entityAdjustment = 0;
        String reason = null;

        if (e1.hasAmounts() && e2.hasAmounts() && amountSimilarity.similar(e1.amounts(), e2.amounts())) {
            entityAdjustment += config.getAmountBoost();
            reason = "Similar amounts mentioned";
        }

        if (e1.hasKeyTerms() && e2.hasKeyTerms()) {
            Set<String> total = new TreeSet<>(e1.keyTerms());
            total.addAll(e2.keyTerms());
            Set<String> common = new TreeSet<>(e1.keyTerms());
            common.retainAll(e2.keyTerms());
            double overlapRatio = (double) common.size() / total.size();

            if (overlapRatio > config.getTermOverlapMinRatio()) {
                entityAdjustment += (int) (overlapRatio * config.getTermOverlapMaxBoost());
                String termReason = String.format(Locale.ROOT, "term overlap (%.0f%%)", overlapRatio * 100);
                reason = reason == null
                        ? Character.toUpperCase(termReason.charAt(0)) + termReason.substring(1)
                        : reason + ", " + termReason;
            }
        }

        double finalScore = Math.min(100, weightedAvg + entityAdjustment);

        return new SimilarityBreakdown(raw1, raw2, tokenSet, partial, tokenSort, basic, weightedAvg,
                e1, e2, key1, key2, classify(tokenSet, partial, tokenSort, basic, finalScore, reason));
    }

    private SimilarityVerdict classify(int tokenSet, int partial, int tokenSort, int basic,
                                       double finalScore, String entityReason) {
        if (tokenSet >= config.getTokenSetThreshold()) {
            if (basic >= config.getBasicRatioFloor()) {
                return SimilarityVerdict.duplicate(finalScore, String.format(Locale.ROOT,
                        "Token set ratio %d%% >= %d%% (basic: %d%%)",
                        tokenSet, config.getTokenSetThreshold(), basic));
            }
            if (entityReason != null) {
                return SimilarityVerdict.duplicate(finalScore, String.format(Locale.ROOT,
                        "Token set %d%% with %s", tokenSet, entityReason));
            }
        }

        // one headline subsumes the other
        if (partial >= config.getPartialThreshold() && tokenSort >= config.getTokenSortFloor()) {
            return SimilarityVerdict.duplicate(finalScore, String.format(Locale.ROOT,
                    "Partial ratio %d%% >= %d%%", partial, config.getPartialThreshold()));
        }

        if (finalScore >= config.entityConfirmedThreshold() && entityReason != null) {
            return SimilarityVerdict.duplicate(finalScore, entityReason);
        }

        return SimilarityVerdict.distinct(finalScore, null);
    }

    /**
     * Terms specific enough that a mismatch means a different subject: long non-generic key
     * terms, known company names, and capitalised words after the first one in the headline.
     */
    Set<String> distinguishingTerms(String rawTitle, EntitySet entities) {
        Set<String> distinguishing = new TreeSet<>();

        for (String term : entities.keyTerms()) {
            if (DedupVocabulary.KNOWN_COMPANIES.contains(term)) {
                distinguishing.add(term);
            } else if (term.length() > 4 && !DedupVocabulary.GENERIC_TERMS.contains(term)) {
                distinguishing.add(term);
            }
        }

        String[] words = rawTitle.trim().split("\\s+");
        for (int i = 0; i < words.length; i++) {
            String clean = NON_WORD.matcher(words[i]).replaceAll("").toLowerCase(Locale.ROOT);
            if (clean.isEmpty() || clean.chars().anyMatch(Character::isDigit)) {
                continue;
            }
            if (DedupVocabulary.KNOWN_COMPANIES.contains(clean)) {
                distinguishing.add(clean);
            } else if (i > 0 && clean.length() > 3
                    && !DedupVocabulary.GENERIC_TERMS.contains(clean)
                    && startsCapitalised(words[i])) {
                distinguishing.add(clean);
            }
        }
        return distinguishing;
    }

    private static boolean startsCapitalised(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                return Character.isUpperCase(c);
            }
        }
        return false;
    }
}
