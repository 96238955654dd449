package org.paycron.services;

import org.paycron.config.utils.LogContext;
import org.paycron.services.jobs.Job;
import org.paycron.services.jobs.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each dispatched firing on its own pooled thread, fire-and-forget.
 * Firings are not bounded in number; a slow payment never delays the next one.
 */
public class ExecutorJobDispatcher implements JobDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorJobDispatcher.class);

    private final ExecutorService executor;
    private final JobContext context;

    public ExecutorJobDispatcher(JobContext context) {
        this(Executors.newCachedThreadPool(new FiringThreadFactory()), context);
    }

    public ExecutorJobDispatcher(ExecutorService executor, JobContext context) {
        this.executor = executor;
        this.context = context;
    }

    @Override
    public void dispatch(Job snapshot) {
        executor.execute(() -> runWithLogging(snapshot));
    }

    private void runWithLogging(Job snapshot) {
        LogContext.startFiring(snapshot.name());
        long start = System.currentTimeMillis();
        try {
            snapshot.execute(context);
        } catch (RuntimeException e) {
            logger.error("Unexpected error in job {}: {}", snapshot.name(), e.getMessage(), e);
        } finally {
            logger.debug("Job {} firing took {}ms", snapshot.name(), System.currentTimeMillis() - start);
            LogContext.clear();
        }
    }

    /**
     * Stops accepting firings and waits for running ones to finish.
     */
    public void stop(Duration gracePeriod) {
        logger.info("Shutting down job executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Job firings still running after {}, interrupting them", gracePeriod);
                executor.shutdownNow();
            } else {
                logger.info("Job executor stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            logger.warn("Job executor shutdown interrupted.");
        }
    }

    private static final class FiringThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "paycron-firing-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }
}
