package com.apex.guardian.service;

import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradeHistoryServiceTest {

    private static final Instant EXIT_TIME = Instant.parse("2024-01-01T12:00:00Z");

    private final TradeHistoryRepository repository = mock(TradeHistoryRepository.class);
    private final TradeHistoryService service = new TradeHistoryService(repository);

    @Test
    void entryIsStoredAsActive() {
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        TradeHistory saved = service.recordEntry(TradeHistory.builder()
                .accountId("A").strategyId("default").symbol("BTCUSDT").direction(Direction.LONG)
                .entryTime(EXIT_TIME).entryPrice(new BigDecimal("45000")).quantity(new BigDecimal("0.02"))
                .exitReason(ExitReason.STOP_HIT)
                .build());

        assertThat(saved.getExitReason()).isEqualTo(ExitReason.ACTIVE);
        assertThat(saved.isOpen()).isTrue();
    }

    @Test
    void exitAddsRealizedPnlFromEarlierPartialClose() {
        TradeHistory open = openShort();
        when(repository.findById(5L)).thenReturn(Optional.of(open));
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        TradeHistory closed = service.completeExit(5L, new BigDecimal("44000"), ExitReason.MANUAL_CLOSE,
                new BigDecimal("5"), new BigDecimal("0.01"), EXIT_TIME).orElseThrow();

        // 5 booked earlier plus 1000 * 0.01 on the remainder
        assertThat(closed.getPnlUsdt()).isEqualByComparingTo("15");
        assertThat(closed.getExitReason()).isEqualTo(ExitReason.MANUAL_CLOSE);
        assertThat(closed.getExitTime()).isEqualTo(EXIT_TIME);
        assertThat(closed.getPnlPct()).isPositive();
    }

    @Test
    void closedRowIsNotOverwritten() {
        TradeHistory alreadyClosed = openShort();
        alreadyClosed.setExitReason(ExitReason.STOP_HIT);
        alreadyClosed.setPnlUsdt(new BigDecimal("-20"));
        when(repository.findById(5L)).thenReturn(Optional.of(alreadyClosed));

        Optional<TradeHistory> result = service.completeExit(5L, new BigDecimal("44000"), ExitReason.EXTERNAL_FLAT,
                null, null, EXIT_TIME);

        assertThat(result).containsSame(alreadyClosed);
        assertThat(alreadyClosed.getExitReason()).isEqualTo(ExitReason.STOP_HIT);
        assertThat(alreadyClosed.getPnlUsdt()).isEqualByComparingTo("-20");
        verify(repository, never()).save(any());
    }

    @Test
    void missingTradeIdIsIgnored() {
        assertThat(service.completeExit(null, BigDecimal.ONE, ExitReason.MANUAL_CLOSE, null, null, EXIT_TIME)).isEmpty();
        verify(repository, never()).findById(any());
    }

    private static TradeHistory openShort() {
        return TradeHistory.builder()
                .id(5L)
                .accountId("A")
                .strategyId("default")
                .symbol("BTCUSDT")
                .direction(Direction.SHORT)
                .entryTime(EXIT_TIME.minusSeconds(3600))
                .entryPrice(new BigDecimal("45000"))
                .quantity(new BigDecimal("0.02"))
                .exitReason(ExitReason.ACTIVE)
                .build();
    }
}
