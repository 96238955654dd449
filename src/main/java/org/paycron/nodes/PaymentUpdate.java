package org.paycron.nodes;

/**
 * One entry of the node's payment status stream.
 *
 * @param outcome       classified status
 * @param status        status exactly as the node reported it
 * @param failureReason node supplied reason, null when none
 */
public record PaymentUpdate(PaymentOutcome outcome, String status, String failureReason) {

    public static PaymentUpdate of(String status, String failureReason) {
        return new PaymentUpdate(PaymentOutcome.classify(status), status, failureReason);
    }
}
