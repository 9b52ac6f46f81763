package com.apex.guardian.service.risk;

import com.apex.guardian.config.RiskProperties;
import com.apex.guardian.exception.RiskProfileNotFoundException;
import com.apex.guardian.model.RiskProfileSettings;
import com.apex.guardian.repository.RiskProfileSettingsRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads risk profiles from the relational store. Each stored version is parsed once; a row with a
 * new version replaces the cached profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskProfileService {

    private final RiskProfileSettingsRepository riskProfileSettingsRepository;
    private final RiskProperties riskProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, RiskProfile> parsedProfiles = new ConcurrentHashMap<>();

    public RiskProfile load(String accountId, String strategyId) {
        return find(accountId, strategyId).orElseThrow(() -> new RiskProfileNotFoundException(accountId, strategyId));
    }

    public Optional<RiskProfile> find(String accountId, String strategyId) {
        Optional<RiskProfileSettings> row = riskProfileSettingsRepository.findByAccountIdAndStrategyId(accountId, strategyId);
        if (row.isEmpty()) {
            parsedProfiles.remove(cacheKey(accountId, strategyId));
            return Optional.empty();
        }
        RiskProfileSettings settings = row.get();
        long version = settings.getVersion() == null ? 0L : settings.getVersion();
        RiskProfile profile = parsedProfiles.compute(cacheKey(accountId, strategyId), (key, cached) ->
                cached != null && cached.version() == version ? cached : parse(settings, version));
        return Optional.of(profile);
    }

    RiskProfile parse(RiskProfileSettings s, long version) {
        TradingSchedule schedule = TradingSchedule.parse(s.getScheduleJson(), objectMapper);
        if (schedule.isMalformed()) {
            log.error("Malformed schedule for account={} strategy={} version={}: {}",
                    s.getAccountId(), s.getStrategyId(), version, schedule.parseError());
        }
        RiskProperties.CircuitBreaker cbDefaults = riskProperties.getCircuitBreaker();
        RiskProperties.DailyLoss dlDefaults = riskProperties.getDailyLoss();
        RiskProfile profile = new RiskProfile(
                s.getAccountId(),
                s.getStrategyId(),
                version,
                or(s.getEnabled(), true),
                or(s.getTierFilterEnabled(), false),
                or(s.getTierCeiling(), riskProperties.getDefaultTierCeiling()),
                or(s.getScheduleEnabled(), false),
                schedule,
                new RiskProfile.CircuitBreakerRule(
                        or(s.getCircuitBreakerEnabled(), false),
                        or(s.getCircuitBreakerMaxLosses(), cbDefaults.getMaxLosses()),
                        or(s.getCircuitBreakerWindowMinutes(), cbDefaults.getWindowMinutes()),
                        or(s.getCircuitBreakerCooldownMinutes(), cbDefaults.getCooldownMinutes())),
                Math.max(0, or(s.getAntiRepetitionWindowMinutes(), 0)),
                parseSymbols(s.getBlacklistedSymbols()),
                new RiskProfile.DailyLossRule(
                        or(s.getDailyLossEnabled(), false),
                        or(s.getDailyLossMaxPct(), dlDefaults.getMaxLossPct()),
                        or(s.getDailyLossPauseHours(), dlDefaults.getPauseDurationHours())),
                or(s.getMaxOpenPositions(), riskProperties.getDefaultMaxOpenPositions()),
                or(s.getRiskPct(), riskProperties.getDefaultRiskPct()),
                or(s.getMaxLeverage(), riskProperties.getDefaultMaxLeverage()),
                or(s.getGuardianEnabled(), true),
                or(s.getHalfCloseEnabled(), false));
        log.info("Loaded risk profile account={} strategy={} version={}", s.getAccountId(), s.getStrategyId(), version);
        return profile;
    }

    private static Set<String> parseSymbols(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(symbol -> !symbol.isEmpty())
                .map(symbol -> symbol.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static <T> T or(T value, T fallback) {
        return Objects.requireNonNullElse(value, fallback);
    }

    private static String cacheKey(String accountId, String strategyId) {
        return accountId + "|" + strategyId;
    }
}
