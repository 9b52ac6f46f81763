package com.apex.guardian.service.risk;

import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.apex.guardian.util.TestFixtures.longBtc;
import static com.apex.guardian.util.TestFixtures.profile;
import static com.apex.guardian.util.TestFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;

class TierFilterGateTest {

    private final TierFilterGate gate = new TierFilterGate();

    @Test
    void rejectsTierAboveCeiling() {
        RiskDecision decision = gate.evaluate(longBtc(8), profile("A").tierCeiling(7).build(), state("A", Instant.now()));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.code()).isEqualTo(RiskRejectCode.TIER_REJECTED);
        assertThat(decision.details()).containsEntry("tier", 8).containsEntry("tierCeiling", 7);
    }

    @Test
    void allowsTierAtCeiling() {
        RiskDecision decision = gate.evaluate(longBtc(9), profile("B").tierCeiling(9).build(), state("B", Instant.now()));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void signalWithoutTierPasses() {
        RiskDecision decision = gate.evaluate(longBtc(null), profile("A").tierCeiling(1).build(), state("A", Instant.now()));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void disabledFilterAcceptsAnyTier() {
        RiskDecision decision = gate.evaluate(longBtc(10), profile("A").build(), state("A", Instant.now()));

        assertThat(decision.allowed()).isTrue();
    }
}
