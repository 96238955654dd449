package org.paycron.lnurl;

import org.paycron.exceptions.MalformedResponseException;
import org.paycron.lnurl.dto.PayInfoResponse;
import org.paycron.services.jobs.JobDefinition;

/**
 * Check run between the info fetch and the payment-request fetch. Throwing
 * aborts the firing before any invoice is requested.
 */
@FunctionalInterface
public interface InvoiceValidator {

    /** Accepts every info response. */
    InvoiceValidator PERMISSIVE = (info, definition) -> {};

    void validate(PayInfoResponse info, JobDefinition definition) throws MalformedResponseException;

    /**
     * Enforces the service's {@code minSendable}/{@code maxSendable} (millisatoshis)
     * and {@code commentAllowed} when the service advertises them.
     */
    static InvoiceValidator sendableRange() {
        return (info, definition) -> {
            long msat = InvoiceNegotiator.toMillisats(definition.amountSats());
            if (info.minSendable() != null && msat < info.minSendable()) {
                throw new MalformedResponseException("Amount " + msat + " msat is below minSendable " + info.minSendable());
            }
            if (info.maxSendable() != null && msat > info.maxSendable()) {
                throw new MalformedResponseException("Amount " + msat + " msat is above maxSendable " + info.maxSendable());
            }
            int commentLength = definition.memoOrEmpty().length();
            if (commentLength > 0 && info.commentAllowed() != null && commentLength > info.commentAllowed()) {
                throw new MalformedResponseException("Memo has " + commentLength + " chars, service allows " + info.commentAllowed());
            }
        };
    }
}
