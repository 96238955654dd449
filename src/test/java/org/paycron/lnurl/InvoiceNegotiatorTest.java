package org.paycron.lnurl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.paycron.exceptions.MalformedResponseException;
import org.paycron.exceptions.NetworkException;
import org.paycron.services.jobs.JobDefinition;
import org.paycron.support.StubHttpServer;

import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvoiceNegotiatorTest {

    private StubHttpServer server;
    private InvoiceNegotiator negotiator;

    @BeforeEach
    void setUp() {
        server = StubHttpServer.start();
        negotiator = InvoiceNegotiator.create(Duration.ofSeconds(2), Duration.ofSeconds(5), InvoiceValidator.PERMISSIVE);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static JobDefinition job(long amountSats, String memo) {
        return new JobDefinition("test", "* * * * * *", amountSats, "alice@example.com", null, memo);
    }

    @Test
    void buildsPaymentRequestUrlFromCallback() throws Exception {
        assertThat(InvoiceNegotiator.buildPaymentRequestUri("https://pay.example/cb", 10000, "hi"))
                .hasToString("https://pay.example/cb?amount=10000000&comment=hi");
    }

    @Test
    void appendsToCallbackThatAlreadyHasQuery() throws Exception {
        assertThat(InvoiceNegotiator.buildPaymentRequestUri("https://pay.example/cb?id=7", 21, ""))
                .hasToString("https://pay.example/cb?id=7&amount=21000&comment=");
    }

    @Test
    void encodesMemoForTheQueryString() throws Exception {
        assertThat(InvoiceNegotiator.buildPaymentRequestUri("https://pay.example/cb", 1, "thanks & see you"))
                .hasToString("https://pay.example/cb?amount=1000&comment=thanks%20%26%20see%20you");
    }

    @Test
    void negotiatesInvoiceInTwoRequests() throws Exception {
        server.respondJson("/.well-known/lnurlp/alice", """
                {"tag":"payRequest","callback":"%s","minSendable":1000,"maxSendable":100000000,"metadata":"[]"}
                """.formatted(server.url("/cb")));
        server.respondJson("/cb", """
                {"pr":"lnbc100u1pexample","routes":[],"successAction":{"tag":"message","message":"Thanks!"}}
                """);

        Invoice invoice = negotiator.requestInvoice(server.url("/.well-known/lnurlp/alice"), job(10000, "hi"));

        assertThat(invoice.paymentRequest()).isEqualTo("lnbc100u1pexample");
        assertThat(invoice.successMessageIfAny()).contains("Thanks!");
        assertThat(server.requests("/cb")).singleElement()
                .satisfies(r -> assertThat(r.query()).isEqualTo("amount=10000000&comment=hi"));
    }

    @Test
    void sendsEmptyCommentWhenJobHasNoMemo() throws Exception {
        server.respondJson("/info", "{\"callback\":\"" + server.url("/cb") + "\"}");
        server.respondJson("/cb", "{\"pr\":\"lnbc1\"}");

        Invoice invoice = negotiator.requestInvoice(server.url("/info"), job(5, null));

        assertThat(invoice.successMessageIfAny()).isEmpty();
        assertThat(server.requests("/cb").get(0).query()).isEqualTo("amount=5000&comment=");
    }

    @Test
    void infoWithoutCallbackIsMalformed() {
        server.respondJson("/info", "{\"tag\":\"payRequest\"}");

        assertThatThrownBy(() -> negotiator.requestInvoice(server.url("/info"), job(1, null)))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("callback");
        assertThat(server.requests("/cb")).isEmpty();
    }

    @Test
    void unparsableBodyIsMalformed() {
        server.respond("/info", 200, "<html>oops</html>");

        assertThatThrownBy(() -> negotiator.requestInvoice(server.url("/info"), job(1, null)))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void lnurlErrorDocumentIsMalformed() {
        server.respondJson("/info", "{\"callback\":\"" + server.url("/cb") + "\"}");
        server.respondJson("/cb", "{\"status\":\"ERROR\",\"reason\":\"amount too low\"}");

        assertThatThrownBy(() -> negotiator.requestInvoice(server.url("/info"), job(1, null)))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("amount too low");
    }

    @Test
    void serverErrorIsNetworkFailure() {
        server.respond("/info", 503, "{}");

        assertThatThrownBy(() -> negotiator.requestInvoice(server.url("/info"), job(1, null)))
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("503");
    }

    @Test
    void unreachableEndpointIsNetworkFailure() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }

        assertThatThrownBy(() -> negotiator.requestInvoice("http://localhost:" + freePort + "/info", job(1, null)))
                .isInstanceOf(NetworkException.class);
    }

    @Test
    void validatorRejectionStopsBeforePaymentRequest() {
        server.respondJson("/info", "{\"callback\":\"" + server.url("/cb") + "\",\"maxSendable\":1000}");
        server.respondJson("/cb", "{\"pr\":\"lnbc1\"}");
        InvoiceNegotiator strict = InvoiceNegotiator.create(
                Duration.ofSeconds(2), Duration.ofSeconds(5), InvoiceValidator.sendableRange());

        assertThatThrownBy(() -> strict.requestInvoice(server.url("/info"), job(2, null)))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("maxSendable");
        assertThat(server.requests("/cb")).isEmpty();
    }
}
