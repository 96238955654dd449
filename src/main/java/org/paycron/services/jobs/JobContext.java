package org.paycron.services.jobs;

import org.paycron.lnurl.InvoiceNegotiator;
import org.paycron.nodes.ConnectionConfig;
import org.paycron.nodes.PaymentExecutor;

import java.util.Objects;

/**
 * Collaborators a firing needs. All three are stateless between firings and
 * shared by every dispatched execution.
 */
public record JobContext(
        InvoiceNegotiator negotiator,
        PaymentExecutor executor,
        ConnectionConfig connection
) {
    public JobContext {
        Objects.requireNonNull(negotiator, "negotiator");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(connection, "connection");
    }
}
