package com.apex.guardian.service.execution;

import com.apex.guardian.config.ExecutionProperties;
import com.apex.guardian.service.MetricsService;
import com.apex.guardian.trading.pipeline.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one signal out to every eligible account of its strategy. Accounts run in parallel on the
 * trading executor; each account's steps stay sequential. Accounts still running when the
 * coordinator timeout expires are cancelled and reported as failed, never dropped. An account
 * that already sent its entry when the deadline hit is reported with that entry.
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    public static final String COORDINATOR_TIMEOUT = "COORDINATOR_TIMEOUT";

    private final AccountDirectory accountDirectory;
    private final AccountTradeExecutor accountTradeExecutor;
    private final ExecutionProperties executionProperties;
    private final MetricsService metricsService;
    private final Executor tradingExecutor;

    public ExecutionCoordinator(AccountDirectory accountDirectory,
                                AccountTradeExecutor accountTradeExecutor,
                                ExecutionProperties executionProperties,
                                MetricsService metricsService,
                                @Qualifier("tradingExecutor") Executor tradingExecutor) {
        this.accountDirectory = accountDirectory;
        this.accountTradeExecutor = accountTradeExecutor;
        this.executionProperties = executionProperties;
        this.metricsService = metricsService;
        this.tradingExecutor = tradingExecutor;
    }

    public DispatchResult dispatch(TradeSignal incoming) {
        metricsService.incrementSignalsReceived();
        String strategyId = accountDirectory.resolveStrategy(incoming.strategyId());
        TradeSignal signal = new TradeSignal(incoming.symbol(), incoming.direction(), incoming.entryPrice(),
                incoming.stopPrice(), incoming.targetPrice(), incoming.riskReward(), incoming.probability(),
                incoming.tier(), incoming.signalQualityScore(), strategyId);

        List<String> accounts = accountDirectory.eligibleAccounts(strategyId);
        log.info("Dispatching {} {} strategy={} to {} account(s)", signal.direction(), signal.symbol(), strategyId,
                accounts.size());

        Map<String, AccountTask> tasks = new LinkedHashMap<>();
        for (String accountId : accounts) {
            DispatchTicket ticket = new DispatchTicket();
            tasks.put(accountId, new AccountTask(ticket,
                    submit(() -> accountTradeExecutor.execute(signal, accountId, strategyId, ticket))));
        }
        List<AccountOutcome> outcomes = collect(tasks, executionProperties.getCoordinatorTimeoutMillis());
        outcomes.forEach(outcome -> metricsService.recordDispatchOutcome(outcome.status().name()));

        DispatchResult result = DispatchResult.of(signal.symbol(), strategyId, outcomes);
        log.info("Dispatch {} strategy={} done: total={} executed={} rejected={} failed={} alerts={}",
                signal.symbol(), strategyId, result.total(), result.executed(), result.rejected(), result.failed(),
                result.alerts());
        return result;
    }

    private record AccountTask(DispatchTicket ticket, Future<AccountOutcome> future) {}

    <T> Future<T> submit(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        FutureTask<T> future = new FutureTask<>(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
        tradingExecutor.execute(future);
        return future;
    }

    private List<AccountOutcome> collect(Map<String, AccountTask> tasks, long timeoutMillis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        List<AccountOutcome> outcomes = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<String, AccountTask> entry : tasks.entrySet()) {
            String accountId = entry.getKey();
            AccountTask task = entry.getValue();
            if (interrupted) {
                outcomes.add(abandon(accountId, task));
                continue;
            }
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                outcomes.add(task.future().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                log.warn("Account {} did not finish within {} ms", accountId, timeoutMillis);
                outcomes.add(abandon(accountId, task));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                outcomes.add(abandon(accountId, task));
            } catch (CancellationException e) {
                outcomes.add(AccountOutcome.failed(accountId, COORDINATOR_TIMEOUT));
            } catch (ExecutionException e) {
                log.error("Account {} task failed", accountId, e.getCause());
                outcomes.add(AccountOutcome.failed(accountId, "INTERNAL_ERROR"));
            }
        }
        return outcomes;
    }

    /**
     * Stops an account that has not sent its entry yet. An account that already sent it keeps
     * running so that its protective orders still get placed, and is reported with its entry.
     */
    private AccountOutcome abandon(String accountId, AccountTask task) {
        if (task.ticket().cancel()) {
            task.future().cancel(true);
            return AccountOutcome.failed(accountId, COORDINATOR_TIMEOUT);
        }
        if (task.future().isDone()) {
            try {
                return task.future().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.error("Account {} task failed after entry", accountId, e.getCause());
            }
        }
        String orderId = task.ticket().entryOrderId();
        log.warn("Account {} entered before the deadline (order={}); protection not confirmed", accountId, orderId);
        return AccountOutcome.unprotected(accountId, COORDINATOR_TIMEOUT, orderId);
    }
}
