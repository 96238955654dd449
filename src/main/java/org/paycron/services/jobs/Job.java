package org.paycron.services.jobs;

import org.paycron.exceptions.ConfigurationException;
import org.paycron.exceptions.DecodeException;
import org.paycron.exceptions.PaymentJobException;
import org.paycron.lnurl.DestinationResolver;
import org.paycron.lnurl.Invoice;
import org.paycron.nodes.PaymentOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;

/**
 * A recurring payment and its schedule position.
 *
 * {@code nextRun}/{@code lastRun} are only changed by {@link #advance()}, which only
 * the scheduler loop calls. Executions run on a {@link #snapshot()}.
 */
public class Job {
    private static final Logger logger = LoggerFactory.getLogger(Job.class);

    private final JobDefinition definition;
    private final RecurrenceRule rule;
    private final String endpoint;
    private final DecodeException destinationError;
    private final Clock clock;

    private Instant nextRun;
    private Instant lastRun;

    private Job(JobDefinition definition, RecurrenceRule rule, String endpoint,
                DecodeException destinationError, Clock clock, Instant nextRun, Instant lastRun) {
        this.definition = definition;
        this.rule = rule;
        this.endpoint = endpoint;
        this.destinationError = destinationError;
        this.clock = clock;
        this.nextRun = nextRun;
        this.lastRun = lastRun;
    }

    /**
     * Builds a job from its definition.
     *
     * @throws ConfigurationException when the cron expression does not parse, the amount is not positive
     *         or the fee ceiling is negative
     */
    public static Job create(JobDefinition definition, DestinationResolver resolver, Clock clock) {
        RecurrenceRule rule;
        try {
            rule = CronRecurrenceRule.parse(definition.cronExpression());
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Job " + definition.displayName() + " has an invalid schedule: "
                    + definition.cronExpression(), e);
        }
        return create(definition, rule, resolver, clock);
    }

    public static Job create(JobDefinition definition, RecurrenceRule rule, DestinationResolver resolver, Clock clock) {
        if (definition.amountSats() <= 0) {
            throw new ConfigurationException("Job " + definition.displayName()
                    + " must pay a positive amount, got " + definition.amountSats());
        }
        if (definition.maxFeeSats() != null && definition.maxFeeSats() < 0) {
            throw new ConfigurationException("Job " + definition.displayName()
                    + " has a negative maxFeeSats: " + definition.maxFeeSats());
        }

        String endpoint = null;
        DecodeException destinationError = null;
        try {
            endpoint = resolver.resolve(definition.lnAddressOrLnurl());
        } catch (DecodeException e) {
            // every firing of this job reports it; other jobs are unaffected
            destinationError = e;
            logger.warn("Job {} has an undecodable destination: {}", definition.displayName(), e.getMessage());
        }

        Instant first = firstAfter(rule.upcoming(clock.instant()), null);
        return new Job(definition, rule, endpoint, destinationError, clock, first, null);
    }

    /**
     * Moves to the next slot: {@code lastRun} takes the current {@code nextRun}, and
     * {@code nextRun} becomes the first fire time after now that is strictly later
     * than the new {@code lastRun}.
     */
    public void advance() {
        if (nextRun == null) {
            return;
        }
        lastRun = nextRun;
        nextRun = firstAfter(rule.upcoming(clock.instant()), lastRun);
    }

    /** A fire time exists and has not been fired yet. */
    public boolean isPending() {
        return nextRun != null && !nextRun.equals(lastRun);
    }

    /**
     * One firing: negotiate an invoice, then pay it. Failures are logged here and
     * never propagate; the schedule is not affected.
     *
     * @return the final payment classification, empty when the firing failed or the node sent nothing
     */
    public Optional<PaymentOutcome> execute(JobContext context) {
        String name = definition.displayName();
        logger.info("Running job {} at {}", name, clock.instant());
        try {
            if (destinationError != null) {
                throw new DecodeException("Cannot resolve destination " + definition.lnAddressOrLnurl()
                        + ": " + destinationError.getMessage(), destinationError);
            }

            Invoice invoice = context.negotiator().requestInvoice(endpoint, definition);
            Optional<PaymentOutcome> outcome = context.executor().pay(invoice, definition, context.connection());

            logger.info("Finished job {} with outcome {}", name, outcome.map(Enum::name).orElse("NONE"));
            return outcome;
        } catch (PaymentJobException e) {
            logger.error("Job {} firing failed ({}): {}", name, e.getClass().getSimpleName(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /** Independent copy for a dispatched execution. */
    public Job snapshot() {
        return new Job(definition, rule, endpoint, destinationError, clock, nextRun, lastRun);
    }

    private static Instant firstAfter(Iterator<Instant> upcoming, Instant floor) {
        while (upcoming.hasNext()) {
            Instant candidate = upcoming.next();
            if (floor == null || candidate.isAfter(floor)) {
                return candidate;
            }
        }
        return null;
    }

    public JobDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.displayName();
    }

    public Optional<String> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<Instant> nextRun() {
        return Optional.ofNullable(nextRun);
    }

    public Optional<Instant> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    @Override
    public String toString() {
        return "Job[" + definition.displayName() + ", next=" + nextRun + ", last=" + lastRun + "]";
    }
}
