package io.mhm.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mhm.core.webhook.DecodeResult;
import io.mhm.core.webhook.RouteOutcome;
import io.mhm.core.webhook.SignatureVerifier;
import io.mhm.core.webhook.WebhookDecoder;
import io.mhm.core.webhook.WebhookEventRouter;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives platform webhooks on any path.
 *
 * <p>POST requests go through header check, signature verification, decoding and routing.
 * Everything after the IO thread runs on Undertow's worker pool so a slow handler never
 * stalls the listener, and every failure ends as a status code rather than a dead thread.
 */
public final class WebhookServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookServer.class);

    static final String SIGNATURE_HEADER = "X-Signature-Ed25519";
    static final String TIMESTAMP_HEADER = "X-Signature-Timestamp";
    static final String LIVENESS_TEXT = "MHM Webhook Server - OK";

    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");

    private final String host;
    private final int requestedPort;
    private final SignatureVerifier verifier;
    private final WebhookDecoder decoder;
    private final WebhookEventRouter router;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;

    private Undertow server;
    private int actualPort;

    public WebhookServer(
        int port,
        String host,
        SignatureVerifier verifier,
        WebhookDecoder decoder,
        WebhookEventRouter router,
        ObjectMapper mapper
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.verifier = verifier;
        this.decoder = decoder;
        this.router = router;
        this.mapper = mapper;
        this.running = new AtomicBoolean(false);
        this.actualPort = port;
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(this::handle)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Webhook server listening on {}:{} for event types {}", host, actualPort, router.registeredTypes());
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
        LOG.info("Webhook server on port {} stopped", actualPort);
    }

    private void handle(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> handle(exchange));
            return;
        }
        try {
            String method = exchange.getRequestMethod().toString();
            switch (method.toUpperCase()) {
                case "POST" -> handleWebhook(exchange);
                case "GET" -> sendText(exchange, 200, LIVENESS_TEXT);
                case "OPTIONS" -> handleOptions(exchange);
                default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
        } catch (Exception e) {
            LOG.error("Unhandled error for {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange);
        }
    }

    private void handleWebhook(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] body = exchange.getInputStream().readAllBytes();

        String signature = header(exchange, SIGNATURE_HEADER);
        String timestamp = header(exchange, TIMESTAMP_HEADER);
        if (signature.isBlank() || timestamp.isBlank()) {
            LOG.warn("Webhook from {} missing signature headers", exchange.getSourceAddress());
            sendJson(exchange, 401, Map.of("error", "missing_signature"));
            return;
        }
        if (!verifier.verify(signature, timestamp, body)) {
            LOG.warn("Webhook from {} failed signature verification", exchange.getSourceAddress());
            sendJson(exchange, 401, Map.of("error", "invalid_signature"));
            return;
        }

        DecodeResult decoded = decoder.decode(body);
        switch (decoded.kind()) {
            case BAD_REQUEST -> {
                LOG.warn("Rejected webhook payload: {}", decoded.error());
                sendJson(exchange, 400, Map.of("error", decoded.error()));
            }
            case PING -> {
                LOG.debug("Webhook PING acknowledged");
                exchange.setStatusCode(204);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.endExchange();
            }
            case EVENT -> {
                RouteOutcome outcome = router.route(decoded.event());
                switch (outcome) {
                    case ACKNOWLEDGED -> sendJson(exchange, outcome.httpStatus(), Map.of("received", true));
                    case REJECTED -> sendJson(exchange, outcome.httpStatus(), Map.of("error", "invalid_event"));
                    case FAILED -> sendJson(exchange, outcome.httpStatus(), Map.of("error", "processing_failed"));
                }
            }
        }
    }

    private void handleOptions(HttpServerExchange exchange) {
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, "*");
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "POST, GET, OPTIONS");
        exchange.getResponseHeaders().put(
            CORS_ALLOW_HEADERS,
            "Content-Type, " + SIGNATURE_HEADER + ", " + TIMESTAMP_HEADER
        );
        exchange.endExchange();
    }

    private void sendText(HttpServerExchange exchange, int status, String text) {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange) {
        if (exchange.isResponseStarted()) {
            exchange.endExchange();
            return;
        }
        try {
            sendJson(exchange, 500, Map.of("error", "internal_error"));
        } catch (IOException e) {
            LOG.debug("Could not write 500 response: {}", e.getMessage());
            exchange.endExchange();
        }
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value.trim();
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }
}
