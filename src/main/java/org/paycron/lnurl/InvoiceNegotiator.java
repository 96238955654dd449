package org.paycron.lnurl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.paycron.exceptions.MalformedResponseException;
import org.paycron.exceptions.NetworkException;
import org.paycron.lnurl.dto.PayInfoResponse;
import org.paycron.lnurl.dto.PayRequestResponse;
import org.paycron.services.jobs.JobDefinition;
import org.paycron.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * LNURL-pay exchange: info fetch, validation, payment-request fetch.
 * Holds no state between firings; safe to share across concurrent firings.
 */
public class InvoiceNegotiator {
    private static final Logger logger = LoggerFactory.getLogger(InvoiceNegotiator.class);

    private static final ObjectMapper mapper = JsonUtil.mapper();

    private final HttpClient client;
    private final Duration requestTimeout;
    private final InvoiceValidator validator;

    public InvoiceNegotiator(HttpClient client, Duration requestTimeout, InvoiceValidator validator) {
        this.client = client;
        this.requestTimeout = requestTimeout;
        this.validator = validator;
    }

    public static InvoiceNegotiator create(Duration connectTimeout, Duration requestTimeout, InvoiceValidator validator) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
        return new InvoiceNegotiator(client, requestTimeout, validator);
    }

    public Invoice requestInvoice(String endpoint, JobDefinition definition)
            throws NetworkException, MalformedResponseException {
        PayInfoResponse info = fetchInfo(endpoint);

        validator.validate(info, definition);

        URI requestUri = buildPaymentRequestUri(info.callback(), definition.amountSats(), definition.memoOrEmpty());
        PayRequestResponse response = fetchPaymentRequest(requestUri);

        logger.debug("Received invoice from {}", info.callback());
        return new Invoice(response.pr(), response.successMessage());
    }

    PayInfoResponse fetchInfo(String endpoint) throws NetworkException, MalformedResponseException {
        URI uri;
        try {
            uri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Invalid LNURL endpoint: " + endpoint, e);
        }

        PayInfoResponse info = getJson(uri, PayInfoResponse.class);
        if (info.isError()) {
            throw new MalformedResponseException("LNURL service returned an error: " + info.reason());
        }
        if (info.callback() == null || info.callback().isBlank()) {
            throw new MalformedResponseException("LNURL info response from " + endpoint + " has no callback");
        }
        return info;
    }

    PayRequestResponse fetchPaymentRequest(URI requestUri) throws NetworkException, MalformedResponseException {
        PayRequestResponse response = getJson(requestUri, PayRequestResponse.class);
        if (response.isError()) {
            throw new MalformedResponseException("LNURL callback returned an error: " + response.reason());
        }
        if (response.pr() == null || response.pr().isBlank()) {
            throw new MalformedResponseException("LNURL callback response has no payment request");
        }
        return response;
    }

    /**
     * {@code callback?amount=<millisats>&comment=<memo>}; joins with {@code &} when the
     * callback already carries a query string.
     */
    static URI buildPaymentRequestUri(String callback, long amountSats, String memo)
            throws MalformedResponseException {
        String separator = callback.contains("?") ? "&" : "?";
        String url = callback
                + separator + "amount=" + toMillisats(amountSats)
                + "&comment=" + URLEncoder.encode(memo, StandardCharsets.UTF_8).replace("+", "%20");
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Invalid LNURL callback: " + callback, e);
        }
    }

    static long toMillisats(long amountSats) {
        return Math.multiplyExact(amountSats, 1000L);
    }

    private <T> T getJson(URI uri, Class<T> type) throws NetworkException, MalformedResponseException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NetworkException("Request to " + uri.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted while calling " + uri.getHost(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Unsupported LNURL URI " + uri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NetworkException("Unexpected HTTP code " + status + " from " + uri.getHost());
        }

        try {
            T body = mapper.readValue(response.body(), type);
            if (body == null) {
                throw new MalformedResponseException("Empty response body from " + uri.getHost());
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Unparsable response from " + uri.getHost() + ": " + e.getOriginalMessage(), e);
        }
    }
}
