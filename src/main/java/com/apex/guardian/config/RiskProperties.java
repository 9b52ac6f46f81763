package com.apex.guardian.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults applied when a stored risk profile leaves a field empty.
 */
@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Min(1)
    @Max(10)
    private int defaultTierCeiling = 10;

    @DecimalMin("0.01")
    private double defaultRiskPct = 2.0;

    @Min(1)
    private int defaultMaxLeverage = 20;

    // Simultaneous open trades per account, 0 for no limit
    @Min(0)
    private int defaultMaxOpenPositions = 0;

    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private DailyLoss dailyLoss = new DailyLoss();

    @Data
    public static class CircuitBreaker {
        @Min(1)
        private int maxLosses = 5;

        @Min(1)
        private int windowMinutes = 1_440;

        @Min(0)
        private int cooldownMinutes = 240;
    }

    @Data
    public static class DailyLoss {
        @DecimalMin("0.01")
        private double maxLossPct = 5.0;

        @Min(1)
        private int pauseDurationHours = 12;
    }
}
