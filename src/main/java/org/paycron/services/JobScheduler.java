package org.paycron.services;

import org.paycron.services.jobs.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single control loop over all jobs: pick the most imminent pending job, wait
 * until it is due, advance it, dispatch a snapshot, repeat.
 *
 * Only the thread calling {@link #run()} touches job schedule state, so no locking is needed.
 */
public class JobScheduler {
    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    public enum State {
        SELECTING,
        /** No job has a pending fire time left. */
        DRAINING,
        /** {@link #shutdown()} was called. */
        SHUTDOWN
    }

    private final List<Job> jobs;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final Waiter waiter;
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    private volatile State state = State.SELECTING;

    public JobScheduler(List<Job> jobs, JobDispatcher dispatcher, Clock clock) {
        this(jobs, dispatcher, clock, null);
    }

    /**
     * @param waiter suspension strategy; null for the default, which {@link #shutdown()} cancels
     */
    public JobScheduler(List<Job> jobs, JobDispatcher dispatcher, Clock clock, Waiter waiter) {
        this.jobs = new ArrayList<>(jobs);
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.waiter = waiter != null ? waiter
                : duration -> !shutdownSignal.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Runs until no job is pending or {@link #shutdown()} is called.
     *
     * @return the terminal state
     */
    public State run() {
        logger.info("Scheduler started with {} job(s)", jobs.size());

        while (true) {
            if (isShutdownRequested()) {
                return finish(State.SHUTDOWN);
            }

            Job job = selectNext();
            if (job == null) {
                logger.info("No more jobs to execute. Scheduler drained.");
                return finish(State.DRAINING);
            }

            Instant due = job.nextRun().orElseThrow();
            Duration wait = Duration.between(clock.instant(), due);
            if (!wait.isNegative() && !wait.isZero()) {
                logger.info("Waiting {} to execute job {} on {}", wait, job.name(), due);
                if (!awaitDue(wait)) {
                    logger.info("Wait for job {} cancelled, nothing more will be dispatched", job.name());
                    return finish(State.SHUTDOWN);
                }
            }

            job.advance();
            try {
                dispatcher.dispatch(job.snapshot());
            } catch (RejectedExecutionException e) {
                logger.error("Could not dispatch job {}: {}", job.name(), e.getMessage());
            }
        }
    }

    /**
     * The pending job with the earliest {@code nextRun}; the first registered wins a tie.
     * Null when no job is pending.
     */
    Job selectNext() {
        Job selected = null;
        for (Job job : jobs) {
            if (!job.isPending()) continue;
            if (selected == null || job.nextRun().get().isBefore(selected.nextRun().get())) {
                selected = job;
            }
        }
        return selected;
    }

    private boolean awaitDue(Duration wait) {
        try {
            return waiter.await(wait) && !isShutdownRequested();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Cancels the current wait. No job is dispatched afterwards. */
    public void shutdown() {
        shutdownSignal.countDown();
    }

    public boolean isShutdownRequested() {
        return shutdownSignal.getCount() == 0;
    }

    public State state() {
        return state;
    }

    private State finish(State terminal) {
        state = terminal;
        return terminal;
    }
}
