package com.apex.guardian.config;

import com.apex.guardian.core.FastStateStore;
import com.apex.guardian.core.RedisFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "guardian.redis.enabled", havingValue = "true")
public class RedisStateConfig {

    // template and connection factory come from spring.data.redis.* auto-configuration
    @Bean
    public FastStateStore fastStateStore(StringRedisTemplate template, GuardianProperties guardianProperties) {
        return new RedisFastStateStore(template, guardianProperties.getRedis().getKeyPrefix());
    }
}
