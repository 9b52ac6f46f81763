package com.apex.guardian.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "guardian")
@Data
@Validated
public class GuardianProperties {

    @Min(0)
    private long stateWriteRetryDelayMillis = 250;

    // Position records outlive any realistic holding period but never live forever
    @Min(1)
    private long positionTtlHours = 24 * 30;

    @Min(1)
    private long lockTimeoutMillis = 5_000;

    private Redis redis = new Redis();

    @Data
    public static class Redis {
        private boolean enabled = false;

        private String keyPrefix = "guardian:";
    }
}
