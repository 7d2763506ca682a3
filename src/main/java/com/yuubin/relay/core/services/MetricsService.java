package com.yuubin.relay.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.yuubin.relay.config.AdminConfig;
import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server.
 * <p>
 * {@code /health} answers 200 "OK" while the health check passes and 503
 * "DOWN" otherwise; {@code /metrics} serves the Prometheus scrape.
 * </p>
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private volatile BooleanSupplier healthCheck = () -> true;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;
    private AdminConfig config;

    public MetricsService(RelayProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    private synchronized void setupAdminServer() {
        if (config == null || !config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            adminServer.createContext("/health", exchange -> {
                boolean up = healthCheck.getAsBoolean();
                respond(exchange, up ? 200 : 503, up ? "OK" : "DOWN");
            });

            // Prometheus text format
            adminServer.createContext("/metrics", exchange -> respond(exchange, 200, registry.scrape()));

            this.adminExecutor = Executors.newCachedThreadPool(ThreadUtils.daemonFactory("admin-http"));
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            this.adminServer = null;
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Sets the check behind {@code /health}.
     * 
     * @param healthCheck Returns true while the relay is healthy.
     */
    public void setHealthCheck(BooleanSupplier healthCheck) {
        this.healthCheck = healthCheck;
    }

    /**
     * Returns the bound admin port, or -1 when the admin server is not running.
     * 
     * @return the port number.
     */
    public synchronized int getPort() {
        return adminServer == null ? -1 : adminServer.getAddress().getPort();
    }

    public synchronized void updateProperties(RelayProperties properties) {
        AdminConfig newConfig = properties.getAdmin();
        if (!java.util.Objects.equals(newConfig, config)) {
            shutdown();
            this.config = newConfig;
            setupAdminServer();
        }
    }

    public synchronized void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
