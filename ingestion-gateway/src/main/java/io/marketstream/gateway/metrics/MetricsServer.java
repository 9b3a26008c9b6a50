package io.marketstream.gateway.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.marketstream.gateway.config.ConnectionConfig;
import io.marketstream.gateway.config.GatewayConfig;
import io.marketstream.gateway.core.ConnectionState;
import io.marketstream.gateway.core.IngestionController;
import io.marketstream.gateway.core.ReconnectSupervisor;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, status, health, and config endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final GatewayConfig config;
    private final IngestionController controller;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    /**
     * @param port Listen port; 0 binds an ephemeral port
     */
    public MetricsServer(int port, GatewayMetrics metrics, GatewayConfig config, IngestionController controller) {
        this.port = port;
        this.config = config;
        this.controller = controller;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        // Metrics endpoint (Prometheus)
        server.createContext("/metrics", handleMetrics());

        // Health endpoint (simple)
        server.createContext("/health", handleHealthSimple());

        // REST API endpoints
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/config", handleConfig());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
        LOGGER.info("  API Health: http://localhost:{}/api/health", boundPort);
    }

    /**
     * Port the server is bound to, or the configured port before {@link #start()}.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> {
            try {
                sendResponse(exchange, 200, "text/plain", "OK");
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                Map<String, ConnectionStatusInfo> connections = new TreeMap<>();

                for (ReconnectSupervisor supervisor : controller.supervisors()) {
                    connections.put(supervisor.id().name().toLowerCase(), new ConnectionStatusInfo(
                        supervisor.id().exchange().name(),
                        supervisor.id().marketType().name(),
                        supervisor.state().name(),
                        supervisor.isFatal(),
                        supervisor.retryAttempts(),
                        supervisor.messageCount(),
                        supervisor.errorCount(),
                        supervisor.lastActivityAt(),
                        supervisor.lastPingAt(),
                        keys(supervisor.subscriptions().desiredSet()),
                        keys(supervisor.subscriptions().confirmedSet())
                    ));
                }

                StatusResponse statusResponse = new StatusResponse(
                    config.gatewayId(),
                    System.currentTimeMillis() - startTime,
                    connections
                );

                sendJson(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(statusResponse));
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                List<String> unhealthy = new ArrayList<>();
                for (ReconnectSupervisor supervisor : controller.supervisors()) {
                    if (supervisor.state() != ConnectionState.STREAMING) {
                        unhealthy.add(supervisor.id().name() + " " + supervisor.state());
                    }
                }

                boolean healthy = unhealthy.isEmpty();
                HealthResponse health = new HealthResponse(
                    healthy,
                    healthy ? "All connections streaming" : String.join(", ", unhealthy)
                );
                sendJson(exchange, healthy ? 200 : 503, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                List<String> connections = new ArrayList<>();
                for (ConnectionConfig connection : config.connections()) {
                    connections.add(connection.exchange() + ":" + connection.marketType() + ":" + connection.enabled()
                        + ":" + keys(connection.subscriptions()));
                }
                ConfigInfo configInfo = new ConfigInfo(
                    config.gatewayId(),
                    config.healthCheckMs(),
                    config.reconnectBaseDelayMs(),
                    config.reconnectMaxDelayMs(),
                    config.reconnectMultiplier(),
                    config.reconnectMaxRetries(),
                    config.dispatchQueueCapacity(),
                    config.dispatchOverflowPolicy().name(),
                    config.metricsPort(),
                    connections
                );

                sendJson(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo));
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private static List<String> keys(Iterable<SubscriptionKey> keys) {
        List<String> result = new ArrayList<>();
        for (SubscriptionKey key : keys) {
            result.add(key.toString());
        }
        return result;
    }

    private void sendJson(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        sendResponse(exchange, statusCode, "application/json", response);
    }

    private static void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String gatewayId, long uptimeMs, Map<String, ConnectionStatusInfo> connections) {}
    private record ConnectionStatusInfo(String exchange, String marketType, String state, boolean fatal, int retryAttempts,
                                        long messages, long errors, long lastActivityAt, long lastPingAt,
                                        List<String> desired, List<String> confirmed) {}
    private record HealthResponse(boolean healthy, String message) {}
    private record ConfigInfo(String gatewayId, int healthCheckMs, long reconnectBaseDelayMs, long reconnectMaxDelayMs,
                              double reconnectMultiplier, int reconnectMaxRetries, int dispatchQueueCapacity,
                              String dispatchOverflowPolicy, int metricsPort, List<String> connections) {}
}
