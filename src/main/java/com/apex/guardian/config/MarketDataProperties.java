package com.apex.guardian.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    private Ttl ttl = new Ttl();

    private String klinesInterval = "5m";

    @Min(1)
    private int klinesLimit = 100;

    @Min(1)
    private int orderBookDepth = 20;

    @Data
    public static class Ttl {
        @Min(1)
        private long markPriceSeconds = 5;

        @Min(1)
        private long orderBookSeconds = 4;

        @Min(1)
        private long klinesSeconds = 60;

        @Min(1)
        private long exchangeFiltersSeconds = 3_600;

        @Min(1)
        private long leverageBracketsSeconds = 3_600;
    }
}
