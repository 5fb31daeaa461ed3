package io.memoria.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoria.core.clarification.ClarificationRequest;
import io.memoria.core.conflict.ConflictCheckRequest;
import io.memoria.core.disclosure.ContextInjectionRequest;
import io.memoria.core.model.MalformedInputException;
import io.memoria.core.pipeline.MemoryPipeline;
import io.memoria.core.pipeline.PayloadReader;
import io.memoria.core.pipeline.TurnRequest;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON over HTTP front for the pipeline stages. Each stage has its own POST endpoint and
 * {@code /pipeline/turn} runs all three.
 */
public final class PipelineServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineServer.class);

    private final String host;
    private final int requestedPort;
    private final MemoryPipeline pipeline;
    private final PayloadReader reader;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public PipelineServer(String host, int port, MemoryPipeline pipeline) {
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.reader = new PayloadReader();
        this.mapper = reader.mapper();
        this.running = new AtomicBoolean(false);
        this.actualPort = port;
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/pipeline/conflicts", exchange -> handleStage(exchange, payload ->
                pipeline.checkConflicts(reader.read(payload, ConflictCheckRequest.class))))
            .addExactPath("/pipeline/clarify", exchange -> handleStage(exchange, payload ->
                pipeline.clarify(reader.read(payload, ClarificationRequest.class))))
            .addExactPath("/pipeline/context", exchange -> handleStage(exchange, payload ->
                pipeline.injectContext(reader.read(payload, ContextInjectionRequest.class))))
            .addExactPath("/pipeline/turn", exchange -> handleStage(exchange, payload ->
                pipeline.runTurn(reader.read(payload, TurnRequest.class))));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Pipeline server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStage(HttpServerExchange exchange, Function<JsonNode, Object> stage) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleStage(exchange, stage);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Object result;
        try {
            result = stage.apply(readJsonBody(exchange));
        } catch (MalformedInputException e) {
            LOG.debug("Rejected payload on {}: {}", exchange.getRequestPath(), e.getMessage());
            sendJson(exchange, 400, Map.of("error", "malformed_input", "message", e.getMessage()));
            return;
        }
        sendJson(exchange, 200, result);
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedInputException("Invalid JSON body", e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request to {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
