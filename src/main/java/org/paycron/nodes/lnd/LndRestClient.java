package org.paycron.nodes.lnd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.paycron.exceptions.ConnectionException;
import org.paycron.nodes.ConnectionConfig;
import org.paycron.nodes.NodeInfo;
import org.paycron.nodes.PaymentInstruction;
import org.paycron.nodes.PaymentNodeClient;
import org.paycron.nodes.PaymentUpdate;
import org.paycron.nodes.PaymentUpdateStream;
import org.paycron.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * LND over its REST gateway. The router's send call answers with one JSON
 * object per line, {@code {"result": Payment}} or {@code {"error": Status}}.
 */
public class LndRestClient implements PaymentNodeClient {
    private static final Logger logger = LoggerFactory.getLogger(LndRestClient.class);

    static final String MACAROON_HEADER = "Grpc-Metadata-macaroon";
    static final String GET_INFO_PATH = "/v1/getinfo";
    static final String SEND_PAYMENT_PATH = "/v2/router/send";

    private static final Duration INFO_TIMEOUT = Duration.ofSeconds(15);
    // headers arrive once LND accepts the payment; the status lines follow
    private static final Duration SEND_GRACE = Duration.ofSeconds(30);

    private static final ObjectMapper mapper = JsonUtil.mapper();

    private final HttpClient client;
    private final String baseUrl;
    private final String macaroonHex;

    public LndRestClient(HttpClient client, String baseUrl, String macaroonHex) {
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.macaroonHex = macaroonHex;
    }

    /**
     * Builds a client trusting the node's certificate and carrying its macaroon.
     * Usable as a {@link org.paycron.nodes.PaymentNodeConnector}.
     */
    public static LndRestClient connect(ConnectionConfig config) throws ConnectionException {
        SSLContext sslContext;
        String macaroon;
        try {
            sslContext = LndTls.sslContext(config.certPath());
        } catch (IOException | GeneralSecurityException e) {
            throw new ConnectionException("Cannot load LND TLS certificate " + config.certPath() + ": " + e.getMessage(), e);
        }
        try {
            macaroon = LndTls.macaroonHex(config.macaroonPath());
        } catch (IOException e) {
            throw new ConnectionException("Cannot read LND macaroon " + config.macaroonPath() + ": " + e.getMessage(), e);
        }

        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .sslContext(sslContext)
                .connectTimeout(config.connectTimeout())
                .build();
        return new LndRestClient(client, config.serverUrl(), macaroon);
    }

    @Override
    public NodeInfo getInfo() throws ConnectionException {
        HttpRequest request = requestBuilder(GET_INFO_PATH)
                .timeout(INFO_TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new ConnectionException("LND getinfo returned HTTP " + response.statusCode() + ": " + response.body());
        }
        try {
            JsonNode json = mapper.readTree(response.body());
            return new NodeInfo(
                    json.path("alias").asText(""),
                    json.path("identity_pubkey").asText(""),
                    json.path("synced_to_chain").asBoolean(false)
            );
        } catch (JsonProcessingException e) {
            throw new ConnectionException("Unparsable LND getinfo response: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public PaymentUpdateStream sendPayment(PaymentInstruction instruction) throws ConnectionException {
        ObjectNode body = mapper.createObjectNode()
                .put("payment_request", instruction.paymentRequest())
                .put("timeout_seconds", instruction.timeoutSeconds())
                .put("fee_limit_sat", Long.toString(instruction.feeLimitSat()))
                .put("no_inflight_updates", false);

        HttpRequest request = requestBuilder(SEND_PAYMENT_PATH)
                .timeout(Duration.ofSeconds(instruction.timeoutSeconds()).plus(SEND_GRACE))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<Stream<String>> response = send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            String error;
            try (Stream<String> lines = response.body()) {
                error = lines.collect(Collectors.joining("\n"));
            } catch (UncheckedIOException e) {
                error = e.getMessage();
            }
            throw new ConnectionException("LND router rejected payment with HTTP " + response.statusCode() + ": " + error);
        }
        logger.debug("LND accepted payment, reading status stream");
        return new LineStream(response.body());
    }

    private HttpRequest.Builder requestBuilder(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header(MACAROON_HEADER, macaroonHex);
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws ConnectionException {
        try {
            return client.send(request, handler);
        } catch (IOException e) {
            throw new ConnectionException("LND request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while calling LND", e);
        }
    }

    static PaymentUpdate parseUpdate(String line) throws ConnectionException {
        JsonNode json;
        try {
            json = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ConnectionException("Unparsable LND stream entry: " + e.getOriginalMessage(), e);
        }

        JsonNode error = json.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ConnectionException("LND payment stream error: " + error.path("message").asText(error.toString()));
        }

        JsonNode result = json.has("result") ? json.get("result") : json;
        String status = result.path("status").asText(null);
        String reason = result.path("failure_reason").asText(null);
        return PaymentUpdate.of(status, reason);
    }

    private static final class LineStream implements PaymentUpdateStream {
        private final Stream<String> lines;
        private final Iterator<String> iterator;

        LineStream(Stream<String> lines) {
            this.lines = lines;
            this.iterator = lines.iterator();
        }

        @Override
        public Optional<PaymentUpdate> next() throws ConnectionException {
            try {
                while (iterator.hasNext()) {
                    String line = iterator.next();
                    if (!line.isBlank()) {
                        return Optional.of(parseUpdate(line));
                    }
                }
                return Optional.empty();
            } catch (UncheckedIOException e) {
                throw new ConnectionException("LND payment stream broke: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            lines.close();
        }
    }
}
