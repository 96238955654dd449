package org.paycron.lnurl.dto;

/**
 * First LNURL-pay response (LUD-06). Only {@code callback} is required.
 * {@code status}/{@code reason} are set when the service answers with an error document.
 */
public record PayInfoResponse(
        String tag,
        String callback,
        Long minSendable,
        Long maxSendable,
        Integer commentAllowed,
        String status,
        String reason
) {
    public boolean isError() {
        return "ERROR".equalsIgnoreCase(status);
    }
}
