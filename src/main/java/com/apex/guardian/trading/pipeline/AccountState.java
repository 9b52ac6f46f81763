package com.apex.guardian.trading.pipeline;

import java.time.Instant;

/**
 * The account a signal is evaluated for and the instant of evaluation.
 */
public record AccountState(String accountId, String strategyId, Instant evaluatedAt) {}
