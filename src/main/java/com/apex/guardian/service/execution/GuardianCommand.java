package com.apex.guardian.service.execution;

import com.apex.guardian.service.guardian.LevelMetadata;

import java.math.BigDecimal;

/**
 * One guardian action for a symbol. A null {@code accountId} targets every account holding a position.
 */
public record GuardianCommand(
        String symbol,
        GuardianAction action,
        BigDecimal stop,
        BigDecimal target,
        String accountId,
        LevelMetadata level,
        boolean moveToBreakEven
) {

    public GuardianCommand {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if ((action == GuardianAction.ADJUST || action == GuardianAction.ADJUST_BOTH) && stop == null) {
            throw new IllegalArgumentException(action + " requires stop");
        }
        if ((action == GuardianAction.ADJUST_TARGET || action == GuardianAction.ADJUST_BOTH) && target == null) {
            throw new IllegalArgumentException(action + " requires target");
        }
    }
}
