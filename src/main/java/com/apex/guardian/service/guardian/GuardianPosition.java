package com.apex.guardian.service.guardian;

import com.apex.guardian.model.Direction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Local shadow of an open position and its protective orders, keyed by (account, symbol).
 * {@code lastAdjustmentTs} doubles as the record version for optimistic writes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GuardianPosition {

    private String accountId;
    private String strategyId;
    private String symbol;
    private Direction direction;
    private BigDecimal entryPrice;
    private BigDecimal quantity;
    private BigDecimal currentStop;
    private BigDecimal currentTarget;
    private String orderId;
    private String slOrderId;
    private String tpOrderId;
    private String levelApplied;
    private Double levelThresholdPct;
    private String previousLevel;
    private long lastAdjustmentTs;
    private BigDecimal previousStop;
    private Long tradeId;
    private BigDecimal realizedPnl;
}
