package com.prediction.market.trading.execution;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.prediction.market.trading.exception.TradeTimeoutException;

import lombok.extern.slf4j.Slf4j;

/**
 * One {@link MarketExecutor} per market, created on first use.
 *
 * Everything that touches a market's pool is funnelled through here. Work on
 * different markets runs in parallel.
 */
@Slf4j
public class MarketExecutionRegistry {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ConcurrentHashMap<String, MarketExecutor> executors = new ConcurrentHashMap<>();
    private final Duration timeout;
    private volatile boolean shutdown;

    public MarketExecutionRegistry(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> Future<T> submit(String marketId, Callable<T> task) {
        if (shutdown) {
            throw new IllegalStateException("Market execution registry is shut down");
        }
        return executors.computeIfAbsent(marketId, MarketExecutor::new).submit(task);
    }

    /**
     * Run {@code task} on the market's thread and wait for it.
     *
     * Runtime exceptions thrown by the task reach the caller unchanged.
     *
     * @throws TradeTimeoutException if no result arrives in time; the task keeps running
     */
    public <T> T execute(String marketId, Callable<T> task) {
        Future<T> future = submit(marketId, task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for market task: marketId={}, timeoutMs={}", marketId, timeout.toMillis());
            throw new TradeTimeoutException(marketId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for market " + marketId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Market task failed for " + marketId, cause);
        }
    }

    public int activeMarkets() {
        return executors.size();
    }

    /**
     * Drain and stop every market thread. Called when the application context closes.
     */
    public void shutdown() {
        shutdown = true;
        log.info("Shutting down market executors: count={}", executors.size());
        executors.values().forEach(executor -> executor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        executors.clear();
    }
}
