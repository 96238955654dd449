package org.paycron.services.jobs;

import java.time.Instant;
import java.util.Iterator;

/**
 * An ordered, usually unbounded, sequence of fire times.
 */
@FunctionalInterface
public interface RecurrenceRule {

    /**
     * Fire times strictly after {@code from}, ascending, computed lazily. Every
     * call starts a fresh sequence; nothing is remembered between calls.
     */
    Iterator<Instant> upcoming(Instant from);
}
