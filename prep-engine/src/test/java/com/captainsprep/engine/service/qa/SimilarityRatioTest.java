package com.captainsprep.engine.service.qa;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityRatioTest {

    @Test
    void identicalTextAfterNormalisationIsOne() {
        assertThat(SimilarityRatio.ratio("What is  the flow RATE?", " what is the flow rate? ")).isEqualTo(1.0);
    }

    @Test
    void ratioIsSymmetric() {
        String a = "How many sections make a pre-connect?";
        String b = "How many sections make a cross-lay?";

        assertThat(SimilarityRatio.ratio(a, b)).isEqualTo(SimilarityRatio.ratio(b, a));
        assertThat(SimilarityRatio.ratio(a, b)).isBetween(0.0, 1.0);
    }

    @Test
    void knownValues() {
        assertThat(SimilarityRatio.ratio("abcd", "abxd")).isCloseTo(0.75, within(1e-9));
        assertThat(SimilarityRatio.ratio("abc", "xyz")).isZero();
        assertThat(SimilarityRatio.ratio("", "")).isEqualTo(1.0);
        assertThat(SimilarityRatio.ratio("abc", null)).isZero();
    }

    @Test
    void normaliseCollapsesWhitespaceAndCase() {
        assertThat(SimilarityRatio.normalise("  Foam\tRatio \n 3%  ")).isEqualTo("foam ratio 3%");
    }
}
