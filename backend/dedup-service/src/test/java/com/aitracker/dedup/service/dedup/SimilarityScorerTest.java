package com.aitracker.dedup.service.dedup;

import com.aitracker.dedup.config.DedupConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityScorerTest {

    private final EntityExtractor extractor = new EntityExtractor();
    private SimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new SimilarityScorer(new DedupConfig());
    }

    private SimilarityVerdict compare(String title1, String title2) {
        return scorer.score(title1, extractor.extract(title1), title2, extractor.extract(title2));
    }

    @Nested
    @DisplayName("Same story, different wording")
    class Duplicates {

        @Test
        @DisplayName("reworded headline merges on token set and basic ratio")
        void rewording() {
            // given
            String existing = "Telangana rolls out global AI innovation entity Aikam";
            String candidate = "Telangana launches global AI innovation entity Aikam";

            // when
            SimilarityVerdict verdict = compare(candidate, existing);

            // then
            assertThat(verdict.duplicate()).isTrue();
            assertThat(verdict.reason()).isEqualTo("Token set ratio 91% >= 88% (basic: 88%)");
            assertThat(verdict.score()).isCloseTo(98.95, within(0.001));
        }

        @Test
        @DisplayName("differently formatted amounts still merge with entity support")
        void formattedAmounts() {
            SimilarityVerdict verdict = compare(
                    "UPC Volt to set up Rs 5k cr AI-ready data centre in Bharat Future City",
                    "UPC Volt to set up AI ready data centre at Telangana's Bharat Future City; "
                            + "₹5,000 crore investment over 5 years estimated");

            assertThat(verdict.duplicate()).isTrue();
            assertThat(verdict.reason()).startsWith("Token set 91% with Similar amounts mentioned");
        }

        @Test
        @DisplayName("same amount confirms a combined score above threshold")
        void combinedWithAmounts() {
            SimilarityVerdict verdict = compare(
                    "Sarvam AI raises $41 million",
                    "Sarvam AI raises $41 mn from Lightspeed");

            assertThat(verdict.duplicate()).isTrue();
            assertThat(verdict.reason()).isEqualTo("Similar amounts mentioned");
            assertThat(verdict.score()).isCloseTo(87.4, within(0.001));
        }

        @Test
        @DisplayName("amount and term overlap reasons are combined")
        void combinedReasons() {
            SimilarityVerdict verdict = compare(
                    "Government approves Rs 10,372 crore IndiaAI Mission",
                    "Cabinet approves ₹10,372 crore for IndiaAI Mission");

            assertThat(verdict.duplicate()).isTrue();
            assertThat(verdict.reason()).isEqualTo("Similar amounts mentioned, term overlap (67%)");
            assertThat(verdict.score()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("identical headlines score 100")
        void identical() {
            SimilarityVerdict verdict = compare(
                    "Infosys opens new AI lab in Bengaluru",
                    "Infosys opens new AI lab in Bengaluru");

            assertThat(verdict.duplicate()).isTrue();
            assertThat(verdict.score()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Same template, different event")
    class Distinct {

        @Test
        @DisplayName("different funding amounts veto the merge")
        void differentRounds() {
            SimilarityVerdict verdict = compare(
                    "Startup X raises $10 million in Series A funding",
                    "Startup X raises $50 million in Series B funding round");

            assertThat(verdict.duplicate()).isFalse();
            assertThat(verdict.reason()).isEqualTo("Different amounts [10mn] vs [50mn]");
            assertThat(verdict.score()).isCloseTo(93.1, within(0.001));
        }

        @Test
        @DisplayName("different companies veto the merge")
        void differentCompanies() {
            SimilarityVerdict verdict = compare(
                    "Google launches new AI model for healthcare",
                    "Microsoft launches new AI model for healthcare");

            assertThat(verdict.duplicate()).isFalse();
            assertThat(verdict.reason()).startsWith("Different subjects");
        }

        @Test
        @DisplayName("follow-up stage of the same policy stays separate")
        void followUp() {
            SimilarityVerdict verdict = compare(
                    "Karnataka announces AI policy framework",
                    "Karnataka AI policy framework implementation begins");

            assertThat(verdict.duplicate()).isFalse();
            assertThat(verdict.reason()).isNull();
            assertThat(verdict.score()).isCloseTo(85.65, within(0.001));
        }

        @Test
        @DisplayName("different company and city is not a merge")
        void differentOffices() {
            SimilarityVerdict verdict = compare(
                    "OpenAI opens first India office in New Delhi",
                    "Anthropic opens first India office in Bengaluru");

            assertThat(verdict.duplicate()).isFalse();
        }
    }

    @Nested
    @DisplayName("Breakdown")
    class Breakdown {

        @Test
        @DisplayName("exposes the four ratios and the weighted average")
        void ratios() {
            String title1 = "Telangana rolls out global AI innovation entity Aikam";
            String title2 = "Telangana launches global AI innovation entity Aikam";

            SimilarityBreakdown breakdown = scorer.explain(
                    title1, extractor.extract(title1), title2, extractor.extract(title2));

            assertThat(breakdown.tokenSet()).isEqualTo(91);
            assertThat(breakdown.partial()).isEqualTo(87);
            assertThat(breakdown.tokenSort()).isEqualTo(88);
            assertThat(breakdown.basic()).isEqualTo(88);
            assertThat(breakdown.weightedAverage()).isCloseTo(88.95, within(0.001));
            assertThat(breakdown.distinguishing2())
                    .containsExactlyInAnyOrder("telangana", "innovation", "entity", "aikam");
        }

        @Test
        @DisplayName("known company names count as distinguishing regardless of length")
        void knownCompanies() {
            Set<String> terms = scorer.distinguishingTerms("TCS and Wipro expand AI teams",
                    extractor.extract("TCS and Wipro expand AI teams"));

            assertThat(terms).contains("tcs", "wipro");
        }
    }

    @Test
    @DisplayName("thresholds come from configuration")
    void configurableThresholds() {
        DedupConfig strict = new DedupConfig();
        strict.setTokenSetThreshold(95);
        strict.setCombinedMargin(20);
        SimilarityScorer strictScorer = new SimilarityScorer(strict);
        String title1 = "Telangana rolls out global AI innovation entity Aikam";
        String title2 = "Telangana launches global AI innovation entity Aikam";

        SimilarityVerdict verdict = strictScorer.score(
                title1, extractor.extract(title1), title2, extractor.extract(title2));

        assertThat(verdict.duplicate()).isFalse();
    }

    @Test
    @DisplayName("amount similarity uses the configured tolerance")
    void amountTolerance() {
        assertThat(scorer.amountsSimilar(Set.of("5000cr"), Set.of("5000"))).isTrue();
        assertThat(scorer.amountsSimilar(Set.of("10mn"), Set.of("50mn"))).isFalse();
    }
}
