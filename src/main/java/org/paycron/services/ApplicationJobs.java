package org.paycron.services;

import org.paycron.config.ConfigLoader.ValidConfig;
import org.paycron.exceptions.ConfigurationException;
import org.paycron.exceptions.ConnectionException;
import org.paycron.lnurl.DestinationResolver;
import org.paycron.lnurl.InvoiceNegotiator;
import org.paycron.lnurl.InvoiceValidator;
import org.paycron.nodes.ConnectionConfig;
import org.paycron.nodes.NodeInfo;
import org.paycron.nodes.PaymentExecutor;
import org.paycron.nodes.PaymentNodeConnector;
import org.paycron.services.jobs.Job;
import org.paycron.services.jobs.JobContext;
import org.paycron.services.jobs.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup wiring: jobs from definitions, the shared firing context, and the
 * one-time payment node check.
 */
public final class ApplicationJobs {
    private static final Logger logger = LoggerFactory.getLogger(ApplicationJobs.class);

    private ApplicationJobs() {}

    public static List<Job> buildJobs(List<JobDefinition> definitions, DestinationResolver resolver, Clock clock) {
        logger.info("[------------ Registering Jobs ------------]");
        List<Job> jobs = new ArrayList<>(definitions.size());
        for (JobDefinition definition : definitions) {
            Job job = Job.create(definition, resolver, clock);
            logger.info("Registered job {} ({} sats, schedule '{}'), first run {}",
                    job.name(), definition.amountSats(), definition.cronExpression(),
                    job.nextRun().map(Object::toString).orElse("never"));
            jobs.add(job);
        }
        logger.info("[***** Registered {} job(s) *****]", jobs.size());
        return jobs;
    }

    public static JobContext buildContext(ValidConfig config, PaymentNodeConnector connector) {
        InvoiceNegotiator negotiator = InvoiceNegotiator.create(
                config.httpConnectTimeout(), config.httpRequestTimeout(), InvoiceValidator.PERMISSIVE);
        return new JobContext(negotiator, new PaymentExecutor(connector), config.connection());
    }

    /**
     * Startup check that the node answers with the configured credentials.
     *
     * @throws ConfigurationException when it does not
     */
    public static NodeInfo verifyNode(ConnectionConfig connection, PaymentNodeConnector connector) {
        try {
            NodeInfo info = connector.connect(connection).getInfo();
            logger.info("Connected to payment node {} (alias={}, synced={})",
                    connection.serverUrl(), info.alias(), info.syncedToChain());
            if (!info.syncedToChain()) {
                logger.warn("Payment node reports it is not synced to chain; payments may fail");
            }
            return info;
        } catch (ConnectionException e) {
            throw new ConfigurationException("Failed to verify connection to payment node " + connection.serverUrl()
                    + ": " + e.getMessage(), e);
        }
    }
}
