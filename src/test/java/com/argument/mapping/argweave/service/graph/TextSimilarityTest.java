package com.argument.mapping.argweave.service.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    private final TextSimilarity textSimilarity = new TextSimilarity();

    @Test
    void normalize_stripsPunctuationAndCollapsesWhitespace() {
        assertThat(textSimilarity.normalize("  Hello,   World! ")).isEqualTo("hello world");
        assertThat(textSimilarity.normalize(null)).isEmpty();
    }

    @Test
    void tokenSortRatio_ignoresWordOrderCaseAndPunctuation() {
        assertThat(textSimilarity.tokenSortRatio("Taxes hurt growth.", "growth HURT taxes")).isEqualTo(1.0);
    }

    @Test
    void tokenSortRatio_isIndelRatioOfSortedTokens() {
        // LCS("kitten", "sitting") = 4
        assertThat(textSimilarity.tokenSortRatio("kitten", "sitting")).isCloseTo(8.0 / 13, within(1e-9));
        assertThat(textSimilarity.tokenSortRatio("abc", "xyz")).isZero();
    }

    @Test
    void tokenSortRatio_blankNeverMatches() {
        assertThat(textSimilarity.tokenSortRatio("", "")).isZero();
        assertThat(textSimilarity.tokenSortRatio(null, "anything")).isZero();
        assertThat(textSimilarity.tokenSortRatio("!!!", "...")).isZero();
    }

    @Test
    void tokenSortRatio_nearDuplicatesScoreAboveDefaultThreshold() {
        double similarity = textSimilarity.tokenSortRatio(
                "Renewable energy reduces long term electricity costs",
                "Renewable energy reduces long term electricity prices");

        assertThat(similarity).isGreaterThanOrEqualTo(0.8).isLessThan(1.0);
    }
}
