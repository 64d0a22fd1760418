package com.contractradar.detection;

import com.contractradar.domain.ParamType;
import com.contractradar.domain.RiskGrade;
import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.RiskLevel;
import com.contractradar.domain.RiskSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskScorerTest {

    private static RiskIndicator indicator(RiskSeverity severity) {
        return new RiskIndicator("id", "token", "Name", severity, "v", "d", ParamType.ON_CHAIN);
    }

    @Test
    @DisplayName("score sums severity weights")
    void sumsWeights() {
        assertThat(RiskScorer.score(List.of(indicator(RiskSeverity.LOW), indicator(RiskSeverity.MEDIUM),
                indicator(RiskSeverity.HIGH)))).isEqualTo(50);
        assertThat(RiskScorer.score(List.of())).isZero();
        assertThat(RiskScorer.score(null)).isZero();
    }

    @Test
    @DisplayName("score is clamped at 100")
    void clamped() {
        assertThat(RiskScorer.score(Collections.nCopies(3, indicator(RiskSeverity.CRITICAL)))).isEqualTo(100);
    }

    @ParameterizedTest
    @CsvSource({"0,A", "20,A", "21,B", "40,B", "41,C", "60,C", "61,D", "80,D", "81,F", "100,F"})
    void gradeBoundaries(int score, RiskGrade expected) {
        assertThat(RiskScorer.grade(score)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"0,LOW", "9,LOW", "10,MEDIUM", "29,MEDIUM", "30,HIGH", "49,HIGH", "50,CRITICAL"})
    void overallRiskBoundaries(int score, RiskLevel expected) {
        assertThat(RiskScorer.overallRisk(score, false)).isEqualTo(expected);
    }

    @Test
    @DisplayName("a single critical indicator makes overall risk critical")
    void criticalOverrides() {
        assertThat(RiskScorer.overallRisk(List.of(indicator(RiskSeverity.CRITICAL))))
                .isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskScorer.overallRisk(5, true)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    @DisplayName("indicator order does not change the score")
    void orderIndependent() {
        List<RiskIndicator> a = List.of(indicator(RiskSeverity.LOW), indicator(RiskSeverity.HIGH));
        List<RiskIndicator> b = List.of(indicator(RiskSeverity.HIGH), indicator(RiskSeverity.LOW));
        assertThat(RiskScorer.score(a)).isEqualTo(RiskScorer.score(b));
    }
}
