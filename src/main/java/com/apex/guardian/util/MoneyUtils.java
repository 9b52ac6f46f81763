package com.apex.guardian.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * USDT amounts are kept at four decimals. Prices and quantities keep the exchange's own precision
 * and are snapped to its tick and lot steps.
 */
public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    /**
     * Percentage of {@code part} over {@code whole}; zero when {@code whole} is not positive.
     */
    public static BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (part == null || whole == null || whole.signum() <= 0) {
            return ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Floors {@code quantity} to a multiple of {@code step}. A missing or non-positive step leaves it unchanged.
     */
    public static BigDecimal floorToStep(BigDecimal quantity, BigDecimal step) {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        if (step == null || step.signum() <= 0) {
            return quantity;
        }
        BigDecimal steps = quantity.divide(step, 0, RoundingMode.FLOOR);
        int scale = Math.max(step.stripTrailingZeros().scale(), 0);
        return steps.multiply(step).setScale(scale, RoundingMode.FLOOR);
    }

    /**
     * Rounds {@code price} to the nearest multiple of {@code tick}.
     */
    public static BigDecimal roundToTick(BigDecimal price, BigDecimal tick) {
        if (price == null || tick == null || tick.signum() <= 0) {
            return price;
        }
        BigDecimal ticks = price.divide(tick, 0, RoundingMode.HALF_UP);
        int scale = Math.max(tick.stripTrailingZeros().scale(), 0);
        return ticks.multiply(tick).setScale(scale, RoundingMode.HALF_UP);
    }

    /**
     * Sign-adjusted PnL of a position moving from {@code entry} to {@code exit}.
     */
    public static BigDecimal pnl(boolean isLong, BigDecimal entry, BigDecimal exit, BigDecimal quantity) {
        BigDecimal move = isLong ? exit.subtract(entry) : entry.subtract(exit);
        return scale(move.multiply(quantity));
    }

    public static BigDecimal pnlPct(boolean isLong, BigDecimal entry, BigDecimal exit) {
        BigDecimal move = isLong ? exit.subtract(entry) : entry.subtract(exit);
        return percent(move, entry);
    }
}
