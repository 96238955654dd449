package org.paycron.nodes;

import java.util.Locale;

/**
 * Classification of one status update streamed by the payment node.
 */
public enum PaymentOutcome {
    SUCCEEDED,
    IN_FLIGHT,
    FAILED;

    /** Anything the node reports other than succeeded or in flight counts as failed. */
    public static PaymentOutcome classify(String nodeStatus) {
        if (nodeStatus == null) return FAILED;
        return switch (nodeStatus.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCEEDED" -> SUCCEEDED;
            case "IN_FLIGHT" -> IN_FLIGHT;
            default -> FAILED;
        };
    }
}
