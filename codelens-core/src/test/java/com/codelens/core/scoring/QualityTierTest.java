package com.codelens.core.scoring;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QualityTier}.
 */
class QualityTierTest {

    @ParameterizedTest
    @CsvSource({
        "1.0, HIGH",
        "0.70, HIGH",
        "0.6999, MEDIUM",
        "0.40, MEDIUM",
        "0.3999, LOW",
        "0.0, LOW"
    })
    void forScore_boundaries_areInclusive(double score, QualityTier expected) {
        assertThat(QualityTier.forScore(score)).isEqualTo(expected);
    }
}
