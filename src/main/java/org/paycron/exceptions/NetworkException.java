package org.paycron.exceptions;

/** The payee endpoint could not be reached or answered with a non-success status. */
public class NetworkException extends PaymentJobException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
