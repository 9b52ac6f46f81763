package com.apex.guardian.service.guardian;

/**
 * Outcome of one guardian action.
 *
 * @param degradedState the exchange was updated but the position record could not be written
 * @param partialFailure the main effect happened but a follow-up step (e.g. break-even stop) did not
 */
public record GuardianActionResult(
        boolean success,
        Status status,
        GuardianResultCode code,
        String message,
        GuardianPosition position,
        boolean degradedState,
        boolean partialFailure
) {

    public enum Status {
        SUCCESS,
        REJECTED,
        FAILED
    }

    public static GuardianActionResult success(GuardianResultCode code, String message, GuardianPosition position) {
        return new GuardianActionResult(true, Status.SUCCESS, code, message, position, false, false);
    }

    public static GuardianActionResult rejected(GuardianResultCode code, String message, GuardianPosition position) {
        return new GuardianActionResult(false, Status.REJECTED, code, message, position, false, false);
    }

    public static GuardianActionResult failed(GuardianResultCode code, String message, GuardianPosition position) {
        return new GuardianActionResult(false, Status.FAILED, code, message, position, false, false);
    }

    public GuardianActionResult withDegradedState(boolean degraded) {
        return new GuardianActionResult(success, status, code, message, position, degraded, partialFailure);
    }

    public GuardianActionResult withPartialFailure(String note) {
        return new GuardianActionResult(success, status, code, message + "; " + note, position, degradedState, true);
    }
}
