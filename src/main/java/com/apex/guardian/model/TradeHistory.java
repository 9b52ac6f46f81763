package com.apex.guardian.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trade_history", indexes = {
        @Index(name = "idx_trade_history_account_strategy_exit", columnList = "account_id,strategy_id,exit_time"),
        @Index(name = "idx_trade_history_account_symbol", columnList = "account_id,symbol")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "strategy_id", nullable = false, length = 64)
    private String strategyId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Direction direction;

    @Column(name = "entry_time", nullable = false)
    private Instant entryTime;

    @Column(name = "entry_price", precision = 24, scale = 8, nullable = false)
    private BigDecimal entryPrice;

    @Column(name = "stop_price", precision = 24, scale = 8)
    private BigDecimal stopPrice;

    @Column(name = "target_price", precision = 24, scale = 8)
    private BigDecimal targetPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal quantity;

    @Column(name = "exit_time")
    private Instant exitTime;

    @Column(name = "exit_price", precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", nullable = false, length = 32)
    private ExitReason exitReason;

    @Column(name = "pnl_pct", precision = 19, scale = 4)
    private BigDecimal pnlPct;

    @Column(name = "pnl_usdt", precision = 19, scale = 4)
    private BigDecimal pnlUsdt;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "sl_order_id", length = 64)
    private String slOrderId;

    @Column(name = "tp_order_id", length = 64)
    private String tpOrderId;

    private Double probability;

    @Column(name = "sqs")
    private Double signalQualityScore;

    @Column(name = "rr")
    private Double riskReward;

    public boolean isOpen() {
        return exitReason == null || exitReason == ExitReason.ACTIVE;
    }
}
