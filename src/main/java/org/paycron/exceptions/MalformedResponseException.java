package org.paycron.exceptions;

/** The payee endpoint answered, but not with a usable LNURL-pay document. */
public class MalformedResponseException extends PaymentJobException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
