package com.apex.guardian.service.execution;

/**
 * Result of one account's part of a dispatch. Carries only the account's own identifiers.
 */
public record AccountOutcome(String accountId, OutcomeStatus status, String reason, String orderId) {

    public static AccountOutcome executed(String accountId, String orderId) {
        return new AccountOutcome(accountId, OutcomeStatus.EXECUTED, null, orderId);
    }

    public static AccountOutcome rejected(String accountId, String reason) {
        return new AccountOutcome(accountId, OutcomeStatus.REJECTED, reason, null);
    }

    public static AccountOutcome failed(String accountId, String reason) {
        return new AccountOutcome(accountId, OutcomeStatus.FAILED, reason, null);
    }

    public static AccountOutcome unprotected(String accountId, String reason, String orderId) {
        return new AccountOutcome(accountId, OutcomeStatus.UNPROTECTED, reason, orderId);
    }
}
