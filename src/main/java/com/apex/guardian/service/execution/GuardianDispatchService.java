package com.apex.guardian.service.execution;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.service.guardian.GuardianActionResult;
import com.apex.guardian.service.guardian.GuardianPosition;
import com.apex.guardian.service.guardian.GuardianResultCode;
import com.apex.guardian.service.guardian.PositionGuardianService;
import com.apex.guardian.service.risk.RiskProfile;
import com.apex.guardian.service.risk.RiskProfileService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies a guardian action to one account or to every account holding a position on the symbol.
 * Closes run in parallel; adjustments and half closes run one account after another.
 */
@Slf4j
@Service
public class GuardianDispatchService {

    private final PositionGuardianService positionGuardianService;
    private final RiskProfileService riskProfileService;
    private final AccountDirectory accountDirectory;
    private final ExecutionCoordinator executionCoordinator;
    private final ExecutionProperties executionProperties;

    public GuardianDispatchService(PositionGuardianService positionGuardianService,
                                   RiskProfileService riskProfileService,
                                   AccountDirectory accountDirectory,
                                   ExecutionCoordinator executionCoordinator,
                                   ExecutionProperties executionProperties) {
        this.positionGuardianService = positionGuardianService;
        this.riskProfileService = riskProfileService;
        this.accountDirectory = accountDirectory;
        this.executionCoordinator = executionCoordinator;
        this.executionProperties = executionProperties;
    }

    public GuardianDispatchResult dispatch(GuardianCommand command) {
        String symbol = command.symbol().trim().toUpperCase(Locale.ROOT);
        List<String> accounts = targetAccounts(command.accountId(), symbol);
        log.info("Guardian {} on {} for {} account(s)", command.action(), symbol, accounts.size());

        List<GuardianDispatchResult.AccountResult> results = command.action() == GuardianAction.CLOSE
                ? runParallel(accounts, symbol, command)
                : runSequential(accounts, symbol, command);
        return GuardianDispatchResult.of(symbol, command.action(), results);
    }

    private List<String> targetAccounts(String accountId, String symbol) {
        if (accountId != null && !accountId.isBlank()) {
            return List.of(accountId);
        }
        List<String> holders = new ArrayList<>();
        for (String candidate : accountDirectory.configuredAccounts()) {
            try {
                if (positionGuardianService.find(candidate, symbol).isPresent()) {
                    holders.add(candidate);
                }
            } catch (RuntimeException e) {
                log.warn("Position lookup failed for account={} symbol={}; including it", candidate, symbol, e);
                holders.add(candidate);
            }
        }
        return holders;
    }

    private List<GuardianDispatchResult.AccountResult> runSequential(List<String> accounts, String symbol,
                                                                     GuardianCommand command) {
        List<GuardianDispatchResult.AccountResult> results = new ArrayList<>();
        for (String accountId : accounts) {
            results.add(new GuardianDispatchResult.AccountResult(accountId, apply(accountId, symbol, command)));
        }
        return results;
    }

    private List<GuardianDispatchResult.AccountResult> runParallel(List<String> accounts, String symbol,
                                                                   GuardianCommand command) {
        Map<String, Future<GuardianActionResult>> tasks = new LinkedHashMap<>();
        for (String accountId : accounts) {
            tasks.put(accountId, executionCoordinator.submit(() -> apply(accountId, symbol, command)));
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(executionProperties.getCoordinatorTimeoutMillis());
        List<GuardianDispatchResult.AccountResult> results = new ArrayList<>();
        for (Map.Entry<String, Future<GuardianActionResult>> task : tasks.entrySet()) {
            GuardianActionResult result;
            try {
                result = task.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // a close that already reached the exchange is left to finish and record itself
                task.getValue().cancel(false);
                result = GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR,
                        ExecutionCoordinator.COORDINATOR_TIMEOUT, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                task.getValue().cancel(false);
                result = GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR,
                        ExecutionCoordinator.COORDINATOR_TIMEOUT, null);
            } catch (ExecutionException e) {
                log.error("Guardian close for account {} failed", task.getKey(), e.getCause());
                result = GuardianActionResult.failed(GuardianResultCode.EXCHANGE_ERROR,
                        "Close failed: " + e.getCause().getMessage(), null);
            }
            results.add(new GuardianDispatchResult.AccountResult(task.getKey(), result));
        }
        return results;
    }

    private GuardianActionResult apply(String accountId, String symbol, GuardianCommand command) {
        Optional<GuardianPosition> position;
        try {
            position = positionGuardianService.find(accountId, symbol);
        } catch (RuntimeException e) {
            log.warn("Position lookup failed for account={} symbol={}: {}", accountId, symbol, e.getMessage());
            position = Optional.empty();
        }
        Optional<RiskProfile> profile = position.flatMap(p -> riskProfileService.find(accountId, p.getStrategyId()));
        if (profile.isPresent() && !profile.get().guardianEnabled()) {
            return GuardianActionResult.rejected(GuardianResultCode.GUARDIAN_DISABLED,
                    "Guardian disabled for account " + accountId, position.get());
        }
        if (command.action() == GuardianAction.HALF_CLOSE && profile.isPresent() && !profile.get().halfCloseEnabled()) {
            return GuardianActionResult.rejected(GuardianResultCode.HALF_CLOSE_DISABLED,
                    "Half close disabled for account " + accountId, position.get());
        }
        return switch (command.action()) {
            case CLOSE -> positionGuardianService.close(accountId, symbol);
            case ADJUST -> positionGuardianService.adjustStop(accountId, symbol, command.stop(), command.level());
            case ADJUST_TARGET -> positionGuardianService.adjustTarget(accountId, symbol, command.target());
            case ADJUST_BOTH -> positionGuardianService.adjustBoth(accountId, symbol, command.stop(), command.target());
            case HALF_CLOSE -> positionGuardianService.halfClose(accountId, symbol, command.moveToBreakEven());
        };
    }
}
