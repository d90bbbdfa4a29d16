package com.chainpulse.analytics.lifecycle;

import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.domain.report.LifecycleReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UserLifecycleAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final String ACTIVE_WALLET = "0x" + "a".repeat(40);
    private static final String NEW_WALLET = "0x" + "b".repeat(40);
    private static final String CHURNED_WALLET = "0x" + "c".repeat(40);

    private final UserLifecycleAnalyzer analyzer = new UserLifecycleAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("stage thresholds follow days since first and last activity")
    void stageThresholds() {
        assertThat(UserLifecycleAnalyzer.stage(0, 1)).isEqualTo(UserLifecycleAnalyzer.NEW);
        assertThat(UserLifecycleAnalyzer.stage(3, 10)).isEqualTo(UserLifecycleAnalyzer.ACTIVE);
        assertThat(UserLifecycleAnalyzer.stage(20, 40)).isEqualTo(UserLifecycleAnalyzer.INACTIVE);
        assertThat(UserLifecycleAnalyzer.stage(60, 100)).isEqualTo(UserLifecycleAnalyzer.DORMANT);
        assertThat(UserLifecycleAnalyzer.stage(120, 200)).isEqualTo(UserLifecycleAnalyzer.CHURNED);
    }

    @Test
    @DisplayName("retention counts active and inactive wallets")
    void retentionRate() {
        assertThat(UserLifecycleAnalyzer.retentionRate(Map.of("active", 2, "inactive", 1, "churned", 1))).isEqualTo(75.0);
        assertThat(UserLifecycleAnalyzer.retentionRate(Map.of())).isZero();
    }

    @Test
    @DisplayName("distribution, cohorts, activation and progression for three wallets")
    void analyzeUserLifecycle() {
        List<NormalizedTransaction> txs = List.of(
                tx("0x01", ACTIVE_WALLET, "approve", Duration.ofDays(10), true),
                tx("0x02", ACTIVE_WALLET, "swap", Duration.ofDays(2), true),
                tx("0x03", NEW_WALLET, "approve", Duration.ofHours(12), true),
                tx("0x04", CHURNED_WALLET, "approve", Duration.ofDays(100), false),
                tx("0x05", CHURNED_WALLET, "approve", Duration.ofDays(95), false));

        LifecycleReport report = analyzer.analyzeUserLifecycle(txs);

        assertThat(report.totalWallets()).isEqualTo(3);
        assertThat(report.lifecycleDistribution())
                .containsEntry("new", 1)
                .containsEntry("active", 1)
                .containsEntry("inactive", 0)
                .containsEntry("dormant", 0)
                .containsEntry("churned", 1);
        assertThat(report.summary().retentionRate()).isCloseTo(100 / 3.0, within(1e-9));
        assertThat(report.summary().averageLifespan()).isCloseTo(13 / 3.0, within(1e-9));

        assertThat(report.cohortAnalysis()).extracting(LifecycleReport.Cohort::cohortPeriod)
                .containsExactly("2024-01", "2024-04", "2024-05");

        assertThat(report.activationMetrics().activatedWallets()).isEqualTo(2);
        assertThat(report.walletClassification().get("experimenter").count()).isEqualTo(3);

        LifecycleReport.ProgressionDepth depth = report.progressionAnalysis().progressionDepth();
        assertThat(depth.singleFunction()).isEqualTo(2);
        assertThat(depth.multiFunction()).isEqualTo(1);
        assertThat(report.progressionAnalysis().topProgressionPaths()).singleElement()
                .satisfies(p -> assertThat(p.path()).isEqualTo("approve → swap"));
    }

    @Test
    @DisplayName("no usable wallets yields the empty report")
    void emptyInput() {
        assertThat(analyzer.analyzeUserLifecycle(List.of()).totalWallets()).isZero();
    }

    private static NormalizedTransaction tx(String hash, String from, String function, Duration ago, boolean success) {
        NormalizedTransaction tx = new NormalizedTransaction();
        tx.setHash(hash);
        tx.setFromAddress(from);
        tx.setFunctionName(function);
        tx.setBlockTimestamp(NOW.minus(ago));
        tx.setSuccess(success);
        return tx;
    }
}
