package org.paycron.nodes;

import org.paycron.exceptions.ConnectionException;
import org.paycron.lnurl.Invoice;
import org.paycron.services.jobs.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Submits an invoice to the payment node and follows the status stream to its end.
 * A payment the node reports as failed is logged, not thrown.
 */
public class PaymentExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PaymentExecutor.class);

    public static final int PAYMENT_TIMEOUT_SECONDS = 30;

    /** Fee ceiling, in percent of the amount, for jobs without an explicit maxFeeSats. */
    public static final int FALLBACK_FEE_PERCENT = 1;

    private final PaymentNodeConnector connector;

    public PaymentExecutor(PaymentNodeConnector connector) {
        this.connector = connector;
    }

    /**
     * @return the classification of the last update the node sent, empty if it sent none
     */
    public Optional<PaymentOutcome> pay(Invoice invoice, JobDefinition definition, ConnectionConfig config)
            throws ConnectionException {
        PaymentNodeClient client = connector.connect(config);

        PaymentInstruction instruction = new PaymentInstruction(
                invoice.paymentRequest(),
                PAYMENT_TIMEOUT_SECONDS,
                feeLimitSat(definition)
        );
        logger.info("Submitting payment of {} sats (fee limit {} sats) for job {}",
                definition.amountSats(), instruction.feeLimitSat(), definition.displayName());

        PaymentOutcome last = null;
        try (PaymentUpdateStream stream = client.sendPayment(instruction)) {
            Optional<PaymentUpdate> next;
            while ((next = stream.next()).isPresent()) {
                PaymentUpdate update = next.get();
                logger.debug("Payment update: status={}, failureReason={}", update.status(), update.failureReason());
                last = update.outcome();

                switch (update.outcome()) {
                    case SUCCEEDED -> {
                        Optional<String> message = invoice.successMessageIfAny();
                        if (message.isPresent()) {
                            logger.info("Payment succeeded for job {}. Receiver says: {}", definition.displayName(), message.get());
                        } else {
                            logger.info("Payment succeeded for job {}", definition.displayName());
                        }
                    }
                    case IN_FLIGHT -> logger.info("Payment in progress for job {}", definition.displayName());
                    case FAILED -> logger.warn("Payment failed for job {}: status={}, reason={}",
                            definition.displayName(), update.status(), update.failureReason());
                }
            }
        }
        return Optional.ofNullable(last);
    }

    /** The job's maxFeeSats, else {@link #FALLBACK_FEE_PERCENT} of the amount rounded up. */
    public static long feeLimitSat(JobDefinition definition) {
        return definition.maxFee()
                .orElseGet(() -> ceilDiv(Math.multiplyExact(definition.amountSats(), (long) FALLBACK_FEE_PERCENT), 100L));
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }
}
