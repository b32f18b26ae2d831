package com.hybridai.gateway.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing provider status.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /status}: provider availability and the primary, as JSON.</li>
 *   <li>{@code GET /health/live}: liveness probe (always 200 if the JVM is alive).</li>
 *   <li>{@code GET /health/ready}: 200 when the gateway is running and at
 *       least one provider is available, otherwise 503.</li>
 * </ul>
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);

    private final HttpServer      server;
    private final ExecutorService executor;
    private final StatusReporter  reporter;
    private final ObjectMapper    mapper = new ObjectMapper();
    private final AtomicBoolean   running = new AtomicBoolean(false);

    /** @param port TCP port to bind; 0 picks a free port */
    public StatusServer(final int port, final StatusReporter reporter) throws IOException {
        this.reporter = reporter;
        this.server   = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "status-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/status",       this::handleStatus);
        server.createContext("/health/live",  this::handleLive);
        server.createContext("/health/ready", this::handleReady);
    }

    public void start() {
        server.start();
        running.set(true);
        LOG.info("Status server started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public void stop() {
        running.set(false);
        server.stop(1);
        executor.shutdownNow();
        LOG.info("Status server stopped");
    }

    private void handleStatus(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, mapper.writeValueAsString(reporter.status().asMap()));
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, "{\"status\":\"ALIVE\"}");
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        final boolean ready = running.get() && reporter.status().hasAvailableProvider();
        respond(exchange, ready ? 200 : 503,
                ready ? "{\"status\":\"READY\"}" : "{\"status\":\"NOT_READY\"}");
    }

    private void respond(final HttpExchange exchange,
                         final int statusCode,
                         final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
