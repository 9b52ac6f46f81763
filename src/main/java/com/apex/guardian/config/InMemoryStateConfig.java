package com.apex.guardian.config;

import com.apex.guardian.core.FastStateStore;
import com.apex.guardian.core.InMemoryFastStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "guardian.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryStateConfig {

    @Bean
    public FastStateStore fastStateStore(GuardianProperties guardianProperties) {
        log.warn("Redis disabled; position and cache state is held in process memory only");
        return new InMemoryFastStateStore(guardianProperties.getRedis().getKeyPrefix());
    }
}
