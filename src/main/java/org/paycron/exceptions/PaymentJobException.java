package org.paycron.exceptions;

/**
 * Base type for failures scoped to a single job firing. These are logged and
 * swallowed by the firing; they never reach the scheduler loop.
 */
public abstract class PaymentJobException extends Exception {

    protected PaymentJobException(String message) {
        super(message);
    }

    protected PaymentJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
