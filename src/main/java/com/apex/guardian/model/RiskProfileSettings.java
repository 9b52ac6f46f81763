package com.apex.guardian.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored risk configuration of one (account, strategy) pair. Nullable columns fall back to
 * configured defaults when the row is parsed into a {@code RiskProfile}.
 */
@Entity
@Table(name = "risk_profiles", uniqueConstraints =
        @UniqueConstraint(name = "uk_risk_profiles_account_strategy", columnNames = {"account_id", "strategy_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfileSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "strategy_id", nullable = false, length = 64)
    private String strategyId;

    private Boolean enabled;

    @Column(name = "tier_filter_enabled")
    private Boolean tierFilterEnabled;

    @Column(name = "tier_ceiling")
    private Integer tierCeiling;

    @Column(name = "schedule_enabled")
    private Boolean scheduleEnabled;

    // {"Monday":[["09:00","17:00"]],...} in UTC
    @Column(name = "schedule_json", columnDefinition = "TEXT")
    private String scheduleJson;

    @Column(name = "circuit_breaker_enabled")
    private Boolean circuitBreakerEnabled;

    @Column(name = "circuit_breaker_max_losses")
    private Integer circuitBreakerMaxLosses;

    @Column(name = "circuit_breaker_window_minutes")
    private Integer circuitBreakerWindowMinutes;

    @Column(name = "circuit_breaker_cooldown_minutes")
    private Integer circuitBreakerCooldownMinutes;

    @Column(name = "anti_repetition_window_minutes")
    private Integer antiRepetitionWindowMinutes;

    // comma separated
    @Column(name = "blacklisted_symbols", length = 2048)
    private String blacklistedSymbols;

    @Column(name = "daily_loss_enabled")
    private Boolean dailyLossEnabled;

    @Column(name = "daily_loss_max_pct")
    private Double dailyLossMaxPct;

    @Column(name = "daily_loss_pause_hours")
    private Integer dailyLossPauseHours;

    // 0 or null: no limit
    @Column(name = "max_open_positions")
    private Integer maxOpenPositions;

    @Column(name = "risk_pct")
    private Double riskPct;

    @Column(name = "max_leverage")
    private Integer maxLeverage;

    @Column(name = "guardian_enabled")
    private Boolean guardianEnabled;

    @Column(name = "half_close_enabled")
    private Boolean halfCloseEnabled;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
