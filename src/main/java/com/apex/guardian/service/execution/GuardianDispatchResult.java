package com.apex.guardian.service.execution;

import com.apex.guardian.service.guardian.GuardianActionResult;

import java.util.List;

public record GuardianDispatchResult(
        String symbol,
        GuardianAction action,
        List<AccountResult> results,
        int total,
        int succeeded,
        int failed
) {

    public record AccountResult(String accountId, GuardianActionResult result) {}

    public static GuardianDispatchResult of(String symbol, GuardianAction action, List<AccountResult> results) {
        int succeeded = (int) results.stream().filter(r -> r.result().success()).count();
        return new GuardianDispatchResult(symbol, action, List.copyOf(results), results.size(), succeeded,
                results.size() - succeeded);
    }
}
