package org.sudandigitalarchive.mcp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sudandigitalarchive.mcp.config.ServerConfig;

import com.sun.net.httpserver.HttpServer;

/**
 * Manages the HTTP server the tool endpoints are served from
 */
public class McpServerManager {
    private static final Logger log = LoggerFactory.getLogger(McpServerManager.class);
    private static final int STOP_DELAY_SECONDS = 1;

    private final ServerConfig config;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * Creates a new McpServerManager
     *
     * @param config the server configuration
     */
    public McpServerManager(ServerConfig config) {
        this.config = config;
    }

    /**
     * Create the HTTP server on the configured address. Endpoints are registered on
     * {@link #getServer()} before {@link #startServer()} is called.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized HttpServer createServer() throws IOException {
        if (server != null) {
            log.info("Stopping existing HTTP server before creating a new one.");
            stopServer();
        }

        server = HttpServer.create(new InetSocketAddress(config.bindAddress(), config.port()), 0);
        executor = Executors.newCachedThreadPool(new HandlerThreadFactory());
        server.setExecutor(executor);
        return server;
    }

    /**
     * Start serving requests.
     *
     * @throws IllegalStateException if {@link #createServer()} has not been called
     */
    public synchronized void startServer() {
        if (server == null) {
            throw new IllegalStateException("Server has not been created");
        }
        server.start();
        log.info("SDA MCP HTTP server started on {}:{}", config.bindAddress(), getPort());
    }

    /**
     * Stop the HTTP server if it is running. In-flight archive calls are abandoned.
     */
    public synchronized void stopServer() {
        if (server != null) {
            log.info("Stopping SDA MCP HTTP server...");
            server.stop(STOP_DELAY_SECONDS);
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(STOP_DELAY_SECONDS, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
            log.info("SDA MCP HTTP server stopped.");
        }
    }

    /**
     * Get the current HTTP server instance
     *
     * @return the HTTP server or null if none has been created
     */
    public synchronized HttpServer getServer() {
        return server;
    }

    /**
     * Port actually bound, which differs from the configured one when that is 0.
     */
    public synchronized int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    public synchronized boolean isServerRunning() {
        return server != null;
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            final Thread thread = new Thread(r, "sda-mcp-handler-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
