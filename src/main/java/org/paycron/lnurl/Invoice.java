package org.paycron.lnurl;

import java.util.Objects;
import java.util.Optional;

/**
 * A payable BOLT11 request obtained for one firing, plus the message the
 * receiver asked to show once paid.
 */
public record Invoice(String paymentRequest, String successMessage) {

    public Invoice {
        Objects.requireNonNull(paymentRequest, "paymentRequest");
    }

    public Optional<String> successMessageIfAny() {
        return Optional.ofNullable(successMessage).filter(m -> !m.isBlank());
    }
}
