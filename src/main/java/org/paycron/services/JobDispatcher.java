package org.paycron.services;

import org.paycron.services.jobs.Job;

/**
 * Hands a job snapshot off for execution. Must return without waiting for the execution.
 */
@FunctionalInterface
public interface JobDispatcher {

    void dispatch(Job snapshot);
}
