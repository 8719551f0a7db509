package com.delta.redirects.resolve.match;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityScorerTest {

    @Test
    void identicalCodesScoreFull() {
        assertThat(SimilarityScorer.similarity("ABC-123", "ABC-123")).isEqualTo(100.0);
        assertThat(SimilarityScorer.similarity("abc", "ABC")).isEqualTo(100.0);
    }

    @Test
    void emptyInputScoresZero() {
        assertThat(SimilarityScorer.similarity("", "abc")).isEqualTo(0.0);
        assertThat(SimilarityScorer.similarity("abc", null)).isEqualTo(0.0);
        assertThat(SimilarityScorer.similarity("", "")).isEqualTo(0.0);
    }

    @Test
    void transliterationVariantsCompareEqual() {
        assertThat(SimilarityScorer.similarity("abx1", "ab1")).isEqualTo(100.0);
        assertThat(SimilarityScorer.similarity("abkh1", "ab1")).isEqualTo(100.0);
        assertThat(SimilarityScorer.similarity("x", "KH")).isEqualTo(100.0);
    }

    @Test
    void normalizationDropsXBeforeKh() {
        assertThat(SimilarityScorer.normalize("KXH-1")).isEqualTo("-1");
        assertThat(SimilarityScorer.normalize("Khaki")).isEqualTo("aki");
    }

    @Test
    void scoreFollowsEditDistanceOfNormalizedCodes() {
        // "yz99" vs "yz100"
        assertThat(SimilarityScorer.similarity("XYZ99", "XYZ100")).isCloseTo(40.0, within(1e-9));
        assertThat(SimilarityScorer.similarity("ABC", "ABD")).isCloseTo(200.0 / 3.0, within(1e-9));
        assertThat(SimilarityScorer.similarity("abcd", "wxyz")).isEqualTo(0.0);
    }

    @Test
    void scoreIsSymmetricAndBounded() {
        String[] samples = {"XYZ100", "abc-1", "Khleb", "lamp", "z", "100500", "kitten", "sitting"};
        for (String a : samples) {
            for (String b : samples) {
                double forward = SimilarityScorer.similarity(a, b);
                assertThat(forward).isEqualTo(SimilarityScorer.similarity(b, a));
                assertThat(forward).isBetween(0.0, 100.0);
            }
        }
    }

    @Test
    void levenshteinUsesUnitCosts() {
        assertThat(SimilarityScorer.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(SimilarityScorer.levenshtein("", "abc")).isEqualTo(3);
        assertThat(SimilarityScorer.levenshtein("abc", "abc")).isZero();
        assertThat(SimilarityScorer.levenshtein("yz99", "yz100")).isEqualTo(3);
    }
}
