package org.paycron.exceptions;

/**
 * The payment node could not be reached, or its status stream broke at the
 * transport level. A payment the node reports as failed is not a ConnectionException.
 */
public class ConnectionException extends PaymentJobException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
