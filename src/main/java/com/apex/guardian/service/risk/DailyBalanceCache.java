package com.apex.guardian.service.risk;

import com.apex.guardian.core.FastStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Start-of-day balance per (account, strategy, UTC date), held until the next UTC midnight.
 * Deposits or withdrawals during the day are not reflected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyBalanceCache {

    private final FastStateStore fastStateStore;

    public BigDecimal initialBalance(String accountId, String strategyId, Instant now, Supplier<BigDecimal> derive) {
        LocalDate day = now.atZone(ZoneOffset.UTC).toLocalDate();
        String key = "balance:" + accountId + ":" + strategyId + ":" + day;
        Optional<String> cached = fastStateStore.get(key);
        if (cached.isPresent()) {
            return new BigDecimal(cached.get());
        }
        BigDecimal derived = derive.get();
        Instant midnight = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        fastStateStore.setIfAbsent(key, derived.toPlainString(), Duration.between(now, midnight));
        log.info("Initial balance for account={} strategy={} on {} = {}", accountId, strategyId, day, derived);
        return fastStateStore.get(key).map(BigDecimal::new).orElse(derived);
    }
}
