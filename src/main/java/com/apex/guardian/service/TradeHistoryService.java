package com.apex.guardian.service;

import com.apex.guardian.model.ExitReason;
import com.apex.guardian.model.TradeHistory;
import com.apex.guardian.repository.TradeHistoryRepository;
import com.apex.guardian.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeHistoryService {

    private final TradeHistoryRepository tradeHistoryRepository;

    @Transactional
    public TradeHistory recordEntry(TradeHistory entry) {
        entry.setExitReason(ExitReason.ACTIVE);
        entry.setExitTime(null);
        entry.setExitPrice(null);
        TradeHistory saved = tradeHistoryRepository.save(entry);
        log.info("Trade opened id={} account={} symbol={} {} qty={} entry={}", saved.getId(), saved.getAccountId(),
                saved.getSymbol(), saved.getDirection(), saved.getQuantity(), saved.getEntryPrice());
        return saved;
    }

    public Optional<TradeHistory> findOpen(String accountId, String symbol) {
        return tradeHistoryRepository.findFirstByAccountIdAndSymbolAndExitReasonOrderByEntryTimeDesc(
                accountId, symbol, ExitReason.ACTIVE);
    }

    /**
     * Completes the open row of a trade. A row that already carries a terminal exit reason is
     * returned unchanged.
     *
     * @param realizedPnl PnL already booked by earlier partial closes
     * @param closedQuantity quantity closed by this exit
     */
    @Transactional
    public Optional<TradeHistory> completeExit(Long tradeId, BigDecimal exitPrice, ExitReason reason,
                                               BigDecimal realizedPnl, BigDecimal closedQuantity, Instant exitTime) {
        if (tradeId == null) {
            return Optional.empty();
        }
        Optional<TradeHistory> found = tradeHistoryRepository.findById(tradeId);
        if (found.isEmpty()) {
            log.warn("Trade history row {} not found; exit {} not recorded", tradeId, reason);
            return Optional.empty();
        }
        TradeHistory trade = found.get();
        if (!trade.isOpen()) {
            log.info("Trade {} already closed with {}; ignoring {}", tradeId, trade.getExitReason(), reason);
            return Optional.of(trade);
        }
        boolean isLong = trade.getDirection().isLong();
        BigDecimal qty = closedQuantity != null ? closedQuantity : trade.getQuantity();
        BigDecimal pnlUsdt = MoneyUtils.add(realizedPnl,
                exitPrice != null && qty != null ? MoneyUtils.pnl(isLong, trade.getEntryPrice(), exitPrice, qty) : null);
        trade.setExitTime(exitTime);
        trade.setExitPrice(exitPrice);
        trade.setExitReason(reason);
        trade.setPnlUsdt(pnlUsdt);
        trade.setPnlPct(exitPrice != null ? MoneyUtils.pnlPct(isLong, trade.getEntryPrice(), exitPrice) : MoneyUtils.ZERO);
        TradeHistory saved = tradeHistoryRepository.save(trade);
        log.info("Trade closed id={} account={} symbol={} reason={} pnl={}", saved.getId(), saved.getAccountId(),
                saved.getSymbol(), reason, pnlUsdt);
        return Optional.of(saved);
    }
}
