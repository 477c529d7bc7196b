package com.prediction.market.trading.execution;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Single worker thread for one market. Tasks run one at a time in submission
 * order, so pricing and pool writes for the market never interleave.
 */
@Slf4j
public class MarketExecutor {

    private final String marketId;
    private final ExecutorService executor;

    public MarketExecutor(String marketId) {
        this.marketId = marketId;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "market-" + marketId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Stop accepting tasks and let queued ones finish.
     */
    public void shutdown(long timeout, TimeUnit unit) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                log.warn("Market executor did not drain in time, interrupting: marketId={}", marketId);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
