package com.apex.guardian.service.risk;

import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.apex.guardian.util.TestFixtures.longBtc;
import static com.apex.guardian.util.TestFixtures.profile;
import static com.apex.guardian.util.TestFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CircuitBreakerGateTest {

    private final TradeHistoryRepository repository = mock(TradeHistoryRepository.class);
    private final CircuitBreakerGate gate = new CircuitBreakerGate(repository);
    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void rejectsWhileCooldownRunsFromLatestLoss() {
        when(repository.findLossesSince(eq("A"), eq("default"), any())).thenReturn(List.of(
                loss(now.minus(Duration.ofMinutes(30))),
                loss(now.minus(Duration.ofMinutes(90))),
                loss(now.minus(Duration.ofMinutes(200)))));

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").circuitBreaker(3, 1440, 60).build(),
                state("A", now));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.code()).isEqualTo(RiskRejectCode.CIRCUIT_BREAKER_ACTIVE);
        assertThat(decision.details()).containsEntry("losses", 3)
                .containsEntry("until", now.plus(Duration.ofMinutes(30)).toString());
    }

    @Test
    void releasesAfterCooldownEvenWithLossesInWindow() {
        when(repository.findLossesSince(eq("A"), eq("default"), any())).thenReturn(List.of(
                loss(now.minus(Duration.ofMinutes(61))),
                loss(now.minus(Duration.ofMinutes(90))),
                loss(now.minus(Duration.ofMinutes(200)))));

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").circuitBreaker(3, 1440, 60).build(),
                state("A", now));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void allowsBelowLossLimit() {
        when(repository.findLossesSince(eq("A"), eq("default"), any())).thenReturn(List.of(
                loss(now.minus(Duration.ofMinutes(5)))));

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").circuitBreaker(2, 60, 60).build(),
                state("A", now));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void queriesTrailingWindow() {
        when(repository.findLossesSince(any(), any(), any())).thenReturn(List.of());

        gate.evaluate(longBtc(5), profile("A").circuitBreaker(2, 120, 60).build(), state("A", now));

        verify(repository).findLossesSince("A", "default", now.minus(Duration.ofMinutes(120)));
    }

    @Test
    void disabledBreakerDoesNotQuery() {
        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").build(), state("A", now));

        assertThat(decision.allowed()).isTrue();
        verify(repository, never()).findLossesSince(any(), any(), any());
    }

    private static TradeHistory loss(Instant exitTime) {
        return TradeHistory.builder()
                .accountId("A")
                .strategyId("default")
                .symbol("BTCUSDT")
                .direction(Direction.LONG)
                .exitReason(ExitReason.STOP_HIT)
                .exitTime(exitTime)
                .pnlUsdt(new BigDecimal("-10"))
                .build();
    }
}
