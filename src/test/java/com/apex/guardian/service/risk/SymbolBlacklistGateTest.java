package com.apex.guardian.service.risk;

import com.apex.guardian.model.Direction;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.apex.guardian.util.TestFixtures.profile;
import static com.apex.guardian.util.TestFixtures.signal;
import static com.apex.guardian.util.TestFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;

class SymbolBlacklistGateTest {

    private final SymbolBlacklistGate gate = new SymbolBlacklistGate();

    @Test
    void matchesCaseInsensitively() {
        RiskDecision decision = gate.evaluate(signal("dogeusdt", Direction.SHORT, "0.1", "0.11", "0.08", 3),
                profile("A").blacklist("DOGEUSDT").build(), state("A", Instant.now()));

        assertThat(decision.code()).isEqualTo(RiskRejectCode.SYMBOL_BLOCKED);
    }

    @Test
    void allowsOtherSymbols() {
        RiskDecision decision = gate.evaluate(signal("BTCUSDT", Direction.LONG, "45000", "44000", "47000", 3),
                profile("A").blacklist("DOGEUSDT").build(), state("A", Instant.now()));

        assertThat(decision.allowed()).isTrue();
    }
}
