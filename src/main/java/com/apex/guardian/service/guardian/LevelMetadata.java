package com.apex.guardian.service.guardian;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Trailing-stop level that produced a stop adjustment, e.g. {@code L2} at 1.5%.
 */
public record LevelMetadata(String level, @JsonAlias("threshold_pct") Double thresholdPct) {}
