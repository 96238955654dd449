package org.paycron.exceptions;

/** A payment address that is neither a lightning address nor a valid bech32 LNURL. */
public class DecodeException extends PaymentJobException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
