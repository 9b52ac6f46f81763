package com.apex.guardian.service.guardian;

import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OpenTradeSweeperTest {

    private TradeHistoryRepository repository;
    private PositionGuardianService positionGuardianService;
    private OpenTradeSweeper sweeper;

    @BeforeEach
    void setUp() {
        repository = mock(TradeHistoryRepository.class);
        positionGuardianService = mock(PositionGuardianService.class);
        sweeper = new OpenTradeSweeper(repository, positionGuardianService);
    }

    @Test
    void settlesEachOpenPositionOnce() {
        when(repository.findByExitReason(ExitReason.ACTIVE)).thenReturn(List.of(
                open("A", "BTCUSDT"), open("A", "BTCUSDT"), open("A", "ETHUSDT"), open("B", "BTCUSDT")));
        when(positionGuardianService.settleIfFlat("A", "BTCUSDT")).thenReturn(Optional.of(ExitReason.STOP_HIT));
        when(positionGuardianService.settleIfFlat("A", "ETHUSDT")).thenReturn(Optional.empty());
        when(positionGuardianService.settleIfFlat("B", "BTCUSDT")).thenReturn(Optional.of(ExitReason.TARGET_HIT));

        int settled = sweeper.settleOpenTrades();

        assertThat(settled).isEqualTo(2);
        verify(positionGuardianService, times(1)).settleIfFlat("A", "BTCUSDT");
    }

    @Test
    void failureOnOneAccountDoesNotStopTheSweep() {
        when(repository.findByExitReason(ExitReason.ACTIVE)).thenReturn(List.of(
                open("A", "BTCUSDT"), open("B", "BTCUSDT")));
        when(positionGuardianService.settleIfFlat("A", "BTCUSDT")).thenThrow(new IllegalStateException("store down"));
        when(positionGuardianService.settleIfFlat("B", "BTCUSDT")).thenReturn(Optional.of(ExitReason.STOP_HIT));

        assertThat(sweeper.settleOpenTrades()).isEqualTo(1);
    }

    @Test
    void scheduledRunSurvivesRepositoryFailure() {
        when(repository.findByExitReason(ExitReason.ACTIVE)).thenThrow(new IllegalStateException("db down"));

        sweeper.sweepOpenTrades();

        verify(repository).findByExitReason(ExitReason.ACTIVE);
    }

    private static TradeHistory open(String accountId, String symbol) {
        return TradeHistory.builder().accountId(accountId).symbol(symbol).exitReason(ExitReason.ACTIVE).build();
    }
}
