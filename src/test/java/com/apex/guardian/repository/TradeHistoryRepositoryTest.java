package com.apex.guardian.repository;

import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class TradeHistoryRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TradeHistoryRepository tradeHistoryRepository;

    @Test
    void lossesAreScopedToAccountAndStrategyNewestFirst() {
        TradeHistory older = entityManager.persist(closed("A", "default", "-5", NOW.minus(3, ChronoUnit.HOURS)));
        TradeHistory newer = entityManager.persist(closed("A", "default", "-2.5", NOW.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(closed("A", "default", "4", NOW.minus(2, ChronoUnit.HOURS)));
        entityManager.persist(closed("A", "scalper", "-9", NOW.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(closed("B", "default", "-9", NOW.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(closed("A", "default", "-7", NOW.minus(2, ChronoUnit.DAYS)));
        entityManager.flush();

        assertThat(tradeHistoryRepository.findLossesSince("A", "default", NOW.minus(1, ChronoUnit.DAYS)))
                .containsExactly(newer, older);
    }

    @Test
    void pnlSumCoversOnlyClosesInWindow() {
        entityManager.persist(closed("A", "default", "-5", NOW.minus(3, ChronoUnit.HOURS)));
        entityManager.persist(closed("A", "default", "2.25", NOW.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(closed("A", "default", "-100", NOW.minus(2, ChronoUnit.DAYS)));
        entityManager.persist(open("A", NOW.minus(30, ChronoUnit.MINUTES)));
        entityManager.flush();

        assertThat(tradeHistoryRepository.sumPnlSince("A", "default", NOW.minus(12, ChronoUnit.HOURS)))
                .isEqualByComparingTo("-2.75");
        assertThat(tradeHistoryRepository.sumPnlSince("C", "default", NOW.minus(12, ChronoUnit.HOURS)))
                .isEqualByComparingTo("0");
    }

    @Test
    void openTradeLookupIgnoresClosedRows() {
        entityManager.persist(closed("A", "default", "1", NOW.minus(1, ChronoUnit.HOURS)));
        TradeHistory open = entityManager.persist(open("A", NOW.minus(10, ChronoUnit.MINUTES)));
        entityManager.flush();

        assertThat(tradeHistoryRepository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc(
                "A", "BTCUSDT", ExitReason.ACTIVE)).contains(open);
        assertThat(tradeHistoryRepository.existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
                "A", "default", "BTCUSDT", Direction.LONG, NOW.minus(15, ChronoUnit.MINUTES))).isTrue();
        assertThat(tradeHistoryRepository.existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
                "A", "default", "BTCUSDT", Direction.SHORT, NOW.minus(15, ChronoUnit.MINUTES))).isFalse();
    }

    @Test
    void openTradesAreCountedPerAccount() {
        entityManager.persist(closed("A", "default", "1", NOW.minus(1, ChronoUnit.HOURS)));
        TradeHistory first = entityManager.persist(open("A", NOW.minus(10, ChronoUnit.MINUTES)));
        TradeHistory second = entityManager.persist(open("A", NOW.minus(5, ChronoUnit.MINUTES)));
        TradeHistory other = entityManager.persist(open("B", NOW.minus(5, ChronoUnit.MINUTES)));
        entityManager.flush();

        assertThat(tradeHistoryRepository.countByAccountIdAndExitReason("A", ExitReason.ACTIVE)).isEqualTo(2);
        assertThat(tradeHistoryRepository.countByAccountIdAndExitReason("C", ExitReason.ACTIVE)).isZero();
        assertThat(tradeHistoryRepository.findByExitReason(ExitReason.ACTIVE))
                .containsExactlyInAnyOrder(first, second, other);
    }

    private static TradeHistory closed(String accountId, String strategyId, String pnl, Instant exitTime) {
        return TradeHistory.builder()
                .accountId(accountId)
                .strategyId(strategyId)
                .symbol("ETHUSDT")
                .direction(Direction.LONG)
                .entryTime(exitTime.minus(20, ChronoUnit.MINUTES))
                .entryPrice(new BigDecimal("2500"))
                .quantity(new BigDecimal("0.1"))
                .exitTime(exitTime)
                .exitPrice(new BigDecimal("2500"))
                .exitReason(new BigDecimal(pnl).signum() < 0 ? ExitReason.STOP_HIT : ExitReason.TARGET_HIT)
                .pnlUsdt(new BigDecimal(pnl))
                .build();
    }

    private static TradeHistory open(String accountId, Instant entryTime) {
        return TradeHistory.builder()
                .accountId(accountId)
                .strategyId("default")
                .symbol("BTCUSDT")
                .direction(Direction.LONG)
                .entryTime(entryTime)
                .entryPrice(new BigDecimal("45000"))
                .quantity(new BigDecimal("0.02"))
                .exitReason(ExitReason.ACTIVE)
                .build();
    }
}
