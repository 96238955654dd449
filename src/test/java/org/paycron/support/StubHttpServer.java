package org.paycron.support;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Embedded Undertow answering fixed routes and recording every request.
 */
public final class StubHttpServer implements AutoCloseable {

    public record RecordedRequest(String method, String path, String query, Map<String, String> headers, String body) {}

    public record StubResponse(int status, String contentType, String body) {
        public static StubResponse json(String body) {
            return new StubResponse(200, "application/json", body);
        }
    }

    private final Map<String, Function<RecordedRequest, StubResponse>> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Undertow server;
    private final int port;

    private StubHttpServer() {
        server = Undertow.builder()
                .addHttpListener(0, "localhost")
                .setHandler(this::handle)
                .build();
        server.start();
        port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public static StubHttpServer start() {
        return new StubHttpServer();
    }

    public StubHttpServer respond(String path, int status, String body) {
        return respond(path, request -> new StubResponse(status, "application/json", body));
    }

    public StubHttpServer respondJson(String path, String body) {
        return respond(path, 200, body);
    }

    public StubHttpServer respond(String path, Function<RecordedRequest, StubResponse> handler) {
        routes.put(path, handler);
        return this;
    }

    public String url(String path) {
        return baseUrl() + path;
    }

    public String baseUrl() {
        return "http://localhost:" + port;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public List<RecordedRequest> requests(String path) {
        return requests.stream().filter(r -> r.path().equals(path)).collect(Collectors.toList());
    }

    private void handle(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            Map<String, String> headers = new HashMap<>();
            for (HeaderValues values : ex.getRequestHeaders()) {
                headers.put(values.getHeaderName().toString().toLowerCase(), values.getFirst());
            }
            RecordedRequest request = new RecordedRequest(
                    ex.getRequestMethod().toString(), ex.getRequestPath(), ex.getQueryString(), headers, body);
            requests.add(request);

            Function<RecordedRequest, StubResponse> route = routes.get(ex.getRequestPath());
            StubResponse response = route != null ? route.apply(request)
                    : new StubResponse(404, "text/plain", "not found");

            ex.setStatusCode(response.status());
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, response.contentType());
            ex.getResponseSender().send(response.body());
        });
    }

    @Override
    public void close() {
        server.stop();
    }
}
