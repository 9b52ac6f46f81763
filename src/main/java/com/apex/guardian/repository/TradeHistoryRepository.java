package com.apex.guardian.repository;

import com.apex.guardian.model.Direction;
import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeHistoryRepository extends JpaRepository<TradeHistory, Long> {

    // Losing closes, newest first
    @Query("select t from TradeHistory t where t.accountId = :accountId and t.strategyId = :strategyId "
            + "and t.pnlUsdt < 0 and t.exitTime >= :since order by t.exitTime desc")
    List<TradeHistory> findLossesSince(@Param("accountId") String accountId,
                                       @Param("strategyId") String strategyId,
                                       @Param("since") Instant since);

    @Query("select coalesce(sum(t.pnlUsdt), 0) from TradeHistory t where t.accountId = :accountId "
            + "and t.strategyId = :strategyId and t.exitTime >= :since")
    BigDecimal sumPnlSince(@Param("accountId") String accountId,
                           @Param("strategyId") String strategyId,
                           @Param("since") Instant since);

    boolean existsByAccountIdAndStrategyIdAndSymbolAndDirectionAndEntryTimeGreaterThanEqual(
            String accountId, String strategyId, String symbol, Direction direction, Instant since);

    List<TradeHistory> findByExitReason(ExitReason exitReason);

    long countByAccountIdAndExitReason(String accountId, ExitReason exitReason);

    Optional<TradeHistory> findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc(
            String accountId, String symbol, ExitReason exitReason);
}
