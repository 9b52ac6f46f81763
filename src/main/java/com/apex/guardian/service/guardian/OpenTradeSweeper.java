package com.apex.guardian.service.guardian;

import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Periodically settles open trades whose stop or target already fired on the exchange, so that
 * history and the loss based gates catch up even when no new signal arrives for the symbol.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "guardian.settle-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class OpenTradeSweeper {

    private final TradeHistoryRepository tradeHistoryRepository;
    private final PositionGuardianService positionGuardianService;

    @Scheduled(fixedDelayString = "${guardian.settle-interval-ms:60000}")
    public void sweepOpenTrades() {
        try {
            int settled = settleOpenTrades();
            if (settled > 0) {
                log.info("Settled {} trade(s) closed on the exchange", settled);
            }
        } catch (RuntimeException e) {
            log.error("Open trade sweep failed", e);
        }
    }

    public int settleOpenTrades() {
        List<TradeHistory> open = tradeHistoryRepository.findByExitReason(ExitReason.ACTIVE);
        Set<String> seen = new LinkedHashSet<>();
        int settled = 0;
        for (TradeHistory trade : open) {
            if (!seen.add(trade.getAccountId() + "|" + trade.getSymbol())) {
                continue;
            }
            MDC.put("accountId", trade.getAccountId());
            try {
                Optional<ExitReason> reason = positionGuardianService.settleIfFlat(trade.getAccountId(), trade.getSymbol());
                if (reason.isPresent()) {
                    settled++;
                }
            } catch (RuntimeException e) {
                log.warn("Settlement check failed for account={} symbol={}: {}", trade.getAccountId(),
                        trade.getSymbol(), e.getMessage());
            } finally {
                MDC.remove("accountId");
            }
        }
        return settled;
    }
}
