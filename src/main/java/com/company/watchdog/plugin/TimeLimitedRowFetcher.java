package com.company.watchdog.plugin;

import com.company.watchdog.domain.FetchedRow;
import com.company.watchdog.domain.QueryDetails;
import com.company.watchdog.exception.RowFetchException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every fetch of the wrapped fetcher with a Resilience4j {@link TimeLimiter}.
 * A hung source surfaces as a {@link RowFetchException} instead of stalling the pass.
 *
 * <p>Cancelling the future does not interrupt a worker stuck in a driver call, so workers are
 * capped at {@code maxConcurrentFetches}. While all of them are busy, further fetches fail at once.
 */
@Slf4j
public class TimeLimitedRowFetcher implements RowFetcher, AutoCloseable {

    private final RowFetcher delegate;
    private final TimeLimiter timeLimiter;
    private final ThreadPoolExecutor executor;

    public TimeLimitedRowFetcher(RowFetcher delegate, TimeLimiter timeLimiter, int maxConcurrentFetches) {
        this.delegate = delegate;
        this.timeLimiter = timeLimiter;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("row-fetch-");
        threadFactory.setDaemon(true);
        this.executor = new ThreadPoolExecutor(0, maxConcurrentFetches, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), threadFactory, new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public List<FetchedRow> fetch(QueryDetails queryDetails) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> delegate.fetch(queryDetails), executor));
        } catch (TimeoutException e) {
            log.error("Row fetch from source {} timed out after {}",
                    queryDetails.getSource(), timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new RowFetchException("Row fetch from source " + queryDetails.getSource() + " timed out", e);
        } catch (RejectedExecutionException e) {
            log.error("All {} row fetch workers are busy, rejecting fetch from source {}",
                    executor.getMaximumPoolSize(), queryDetails.getSource());
            throw new RowFetchException("No free row fetch worker for source " + queryDetails.getSource(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RowFetchException("Interrupted while fetching from source " + queryDetails.getSource(), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RowFetchException("Row fetch from source " + queryDetails.getSource() + " failed", e);
        }
    }

    int workerCount() {
        return executor.getPoolSize();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
