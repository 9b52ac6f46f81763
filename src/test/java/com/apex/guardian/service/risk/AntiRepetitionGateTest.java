package com.apex.guardian.service.risk;

import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.apex.guardian.util.TestFixtures.longBtc;
import static com.apex.guardian.util.TestFixtures.profile;
import static com.apex.guardian.util.TestFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AntiRepetitionGateTest {

    private final TradeHistoryRepository repository = mock(TradeHistoryRepository.class);
    private final AntiRepetitionGate gate = new AntiRepetitionGate(repository);
    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void rejectsSameTradeInsideWindow() {
        when(repository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc("A", "BTCUSDT", ExitReason.ACTIVE))
                .thenReturn(Optional.empty());
        when(repository.existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
                "A", "default", "BTCUSDT", Direction.LONG, now.minus(Duration.ofMinutes(30)))).thenReturn(true);

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").antiRepetition(30).build(), state("A", now));

        assertThat(decision.code()).isEqualTo(RiskRejectCode.RECENT_DUPLICATE);
    }

    @Test
    void allowsOutsideWindow() {
        when(repository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc(any(), any(), any()))
                .thenReturn(Optional.empty());
        when(repository.existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
                any(), any(), any(), any(), any())).thenReturn(false);

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").antiRepetition(30).build(), state("A", now));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void rejectsWhenPositionAlreadyOpen() {
        when(repository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc("A", "BTCUSDT", ExitReason.ACTIVE))
                .thenReturn(Optional.of(TradeHistory.builder().exitReason(ExitReason.ACTIVE).build()));

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").build(), state("A", now));

        assertThat(decision.code()).isEqualTo(RiskRejectCode.POSITION_ALREADY_OPEN);
    }
}
