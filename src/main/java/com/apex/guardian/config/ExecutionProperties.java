package com.apex.guardian.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotBlank
    private String defaultStrategy = "default";

    // Accounts configured per strategy id
    private Map<String, List<String>> strategyAccounts = new LinkedHashMap<>();

    @Min(1)
    private int maxParallelAccounts = 8;

    @Min(1)
    private long coordinatorTimeoutMillis = 15_000;

    // Protective stop/target placement after entry fill
    @Min(0)
    private int protectiveRetryAttempts = 3;

    @Min(0)
    private long protectiveRetryDelayMillis = 500;

    private Exchange exchange = new Exchange();

    private Paper paper = new Paper();

    public List<String> accountsFor(String strategyId) {
        List<String> accounts = strategyAccounts.get(strategyId);
        return accounts == null ? new ArrayList<>() : accounts;
    }

    @Data
    public static class Exchange {
        @Min(1)
        private long callTimeoutMillis = 5_000;

        @Min(1)
        private int retryMaxAttempts = 3;

        @Min(1)
        private long retryBaseDelayMillis = 200;

        private double retryJitterFactor = 0.2;

        @Min(1)
        private int rateLimitPerSecond = 10;

        @Min(0)
        private long rateLimitTimeoutMillis = 1_000;
    }

    /**
     * Simulated exchange used when no live gateway is wired in.
     */
    @Data
    public static class Paper {
        private boolean enabled = true;

        private double initialBalance = 1_000.0;

        private double tickSize = 0.1;

        private double stepSize = 0.001;

        private double minQty = 0.001;

        @Min(1)
        private int maxLeverage = 50;

        // Seed mark prices per symbol
        private Map<String, Double> markPrices = new LinkedHashMap<>();
    }
}
