package io.pqcscan.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskLevelTest {

    @ParameterizedTest
    @CsvSource({
            "0.0, LOW",
            "1.99, LOW",
            "2.0, MEDIUM",
            "4.99, MEDIUM",
            "5.0, HIGH",
            "8.0, HIGH",
            "8.01, CATASTROPHIC",
            "120.0, CATASTROPHIC"
    })
    void fromScore_bucketsByThreshold(double score, RiskLevel expected) {
        assertThat(RiskLevel.fromScore(score)).isEqualTo(expected);
    }

    @Test
    void severity_isAtLeastFollowsRank() {
        assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.HIGH.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.MEDIUM.isAtLeast(Severity.HIGH)).isFalse();
        assertThat(Severity.INFO.isAtLeast(Severity.INFO)).isTrue();
    }

    @Test
    void severity_riskWeights() {
        assertThat(Severity.CRITICAL.riskWeight()).isEqualTo(10.0);
        assertThat(Severity.HIGH.riskWeight()).isEqualTo(7.0);
        assertThat(Severity.MEDIUM.riskWeight()).isEqualTo(4.0);
        assertThat(Severity.LOW.riskWeight()).isEqualTo(1.0);
        assertThat(Severity.INFO.riskWeight()).isEqualTo(0.0);
    }

    @Test
    void severity_parseRejectsUnknownValue() {
        assertThat(Severity.parse(" High ")).isEqualTo(Severity.HIGH);
        assertThatThrownBy(() -> Severity.parse("severe"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finding_rejectsConfidenceOutOfRange() {
        SourceLocation location = new SourceLocation("a.py", 1, 1, "x");
        assertThatThrownBy(() -> Finding.builder()
                .id("PQC-1").patternId("p").severity(Severity.LOW)
                .primitiveFamily(PrimitiveFamily.BROKEN_HASH)
                .location(location).confidence(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sourceLocation_snippetIsTrimmedAndTruncated() {
        assertThat(SourceLocation.snippetOf("   key = rsa()  ")).isEqualTo("key = rsa()");
        String longLine = "x".repeat(300);
        assertThat(SourceLocation.snippetOf(longLine)).hasSize(SourceLocation.MAX_SNIPPET_LENGTH + 3);
    }
}
