package com.apex.guardian.service.execution;

public enum OutcomeStatus {
    EXECUTED,
    REJECTED,
    FAILED,
    /**
     * Entry filled but the protective stop or target could not be placed.
     */
    UNPROTECTED
}
