package com.remit.matching.scoring;

import com.remit.matching.normalize.NormalizationPass;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    private double score(NormalizationPass pass, String original, String matched, boolean amountMatches) {
        return scorer.score(pass, original, matched, amountMatches).doubleValue();
    }

    @Nested
    class SimilarityTests {

        @Test
        void shouldBeOneForIdenticalStrings() {
            assertThat(ConfidenceScorer.similarity("INV-001", "INV-001")).isEqualTo(1.0);
        }

        @Test
        void shouldIgnoreCase() {
            assertThat(ConfidenceScorer.similarity("abc", "ABC")).isEqualTo(1.0);
        }

        @Test
        void shouldBeZeroWhenEitherIsEmpty() {
            assertThat(ConfidenceScorer.similarity("", "ABC")).isZero();
            assertThat(ConfidenceScorer.similarity("ABC", "")).isZero();
            assertThat(ConfidenceScorer.similarity(null, "ABC")).isZero();
        }

        @Test
        void shouldComputeJaccardOverDistinctCharacters() {
            // {a,b} and {b,c}: one shared of three
            assertThat(ConfidenceScorer.similarity("abab", "bc")).isCloseTo(1.0 / 3, within(1e-12));
        }
    }

    @Nested
    class PassScoringTests {

        @Test
        void shouldGiveBaseConfidenceToIdenticalExactMatch() {
            assertThat(score(NormalizationPass.EXACT, "EXACT-MATCH-001", "EXACT-MATCH-001", true))
                .isCloseTo(0.95, within(1e-9));
        }

        @Test
        void shouldPenalizeExactMatchWithDissimilarText() {
            // the surrounding spaces add ' ' to the character set: 10 shared of 11
            assertThat(score(NormalizationPass.EXACT, "  EXACT-MATCH-001 ", "EXACT-MATCH-001", true))
                .isCloseTo(0.95 * 0.90, within(1e-9));
        }

        @Test
        void shouldScaleRelaxedMatchBySimilarity() {
            // 7 shared characters of 8
            double expected = 0.85 * (0.7 + 0.3 * 0.875);

            assertThat(score(NormalizationPass.RELAXED, "INV39832", "INV 39832", true))
                .isCloseTo(expected, within(1e-9));
        }

        @Test
        void shouldWeightSimilarityHeavilyForNumericMatch() {
            // {1,2,3} against {a,b,c,-,1,2,3,d,e,f}
            double expected = 0.70 * (0.5 + 0.5 * 0.3);

            assertThat(score(NormalizationPass.NUMERIC, "123", "ABC-123-DEF", true))
                .isCloseTo(expected, within(1e-9));
        }

        @Test
        void shouldPenalizeAmountDisagreement() {
            double agreeing = score(NormalizationPass.NUMERIC, "123", "ABC-123-DEF", true);
            double disagreeing = score(NormalizationPass.NUMERIC, "123", "ABC-123-DEF", false);

            assertThat(disagreeing).isCloseTo(agreeing * 0.70, within(1e-9));
        }

        @Test
        void shouldStayWithinBoundsForAnyInput() {
            List<String[]> pairs = List.of(
                new String[]{"", ""},
                new String[]{"x", "INVOICE-0001"},
                new String[]{"INVOICE-0001", "INVOICE-0001"},
                new String[]{"%%%", "123"});

            for (NormalizationPass pass : NormalizationPass.values()) {
                for (String[] pair : pairs) {
                    for (boolean amount : new boolean[]{true, false}) {
                        BigDecimal confidence = scorer.score(pass, pair[0], pair[1], amount);
                        assertThat(confidence).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
                    }
                }
            }
        }
    }

    @Nested
    class OverallConfidenceTests {

        @Test
        void shouldScaleAverageByMatchedShare() {
            List<BigDecimal> lines = Arrays.asList(new BigDecimal("0.9"), null, new BigDecimal("0.7"), null);

            assertThat(ConfidenceScorer.overallConfidence(lines, null)).isEqualByComparingTo("0.4");
        }

        @Test
        void shouldFallBackToLowConfidenceWithoutMatches() {
            assertThat(ConfidenceScorer.overallConfidence(Arrays.asList(null, null), null))
                .isEqualByComparingTo("0.20");
        }

        @Test
        void shouldAverageWithExtractionConfidence() {
            List<BigDecimal> lines = List.of(new BigDecimal("0.8"));

            assertThat(ConfidenceScorer.overallConfidence(lines, new BigDecimal("0.6")))
                .isEqualByComparingTo("0.7");
        }

        @Test
        void shouldUseFourDecimalPlaces() {
            List<BigDecimal> lines = Arrays.asList(new BigDecimal("1"), null, null);

            assertThat(ConfidenceScorer.overallConfidence(lines, null)).isEqualTo(new BigDecimal("0.3333"));
        }
    }
}
