package org.paycron.lnurl.dto;

/**
 * Callback response carrying the invoice ({@code pr}) and the optional
 * success action (LUD-09).
 */
public record PayRequestResponse(
        String pr,
        SuccessAction successAction,
        String status,
        String reason
) {
    public boolean isError() {
        return "ERROR".equalsIgnoreCase(status);
    }

    public String successMessage() {
        return successAction != null ? successAction.message() : null;
    }

    public record SuccessAction(String tag, String message, String description, String url) {}
}
