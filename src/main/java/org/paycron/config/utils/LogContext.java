package org.paycron.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Centralized MDC context management for consistent logging.
 * Adds "component" and "trace.id" metadata to every log entry.
 */
public class LogContext {
    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";

    private LogContext() {}

    public static void start(String component) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, UUID.randomUUID().toString());
    }

    /**
     * One firing of a job gets its own trace id, so interleaved firings
     * of the same job stay distinguishable.
     */
    public static void startFiring(String jobName) {
        start("Job[" + jobName + "]");
    }

    public static void clear() {
        MDC.clear();
    }
}



/**
 *| Action                              | Rule                                          |
 * | ----------------------------------- | --------------------------------------------- |
 * | At start of any operation           | `LogContext.start("ComponentName")`           |
 * | At start of a job firing            | `LogContext.startFiring(jobName)`             |
 * | At end (in finally block)           | `LogContext.clear()`                          |
 * | Never log outside context           | Each thread must have its own MDC             |
 * | Dispatched firings                  | Context is started inside the runnable        |
 * */
