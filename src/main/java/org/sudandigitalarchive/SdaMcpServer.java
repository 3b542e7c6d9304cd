package org.sudandigitalarchive;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sudandigitalarchive.mcp.McpServerManager;
import org.sudandigitalarchive.mcp.api.ApiHandlerRegistry;
import org.sudandigitalarchive.mcp.client.SdaClient;
import org.sudandigitalarchive.mcp.config.ServerConfig;
import org.sudandigitalarchive.mcp.services.AccessionService;
import org.sudandigitalarchive.mcp.services.SubjectService;
import org.sudandigitalarchive.mcp.telemetry.TelemetryLogger;

/**
 * Standalone server that exposes the Sudan Digital Archive API as MCP tools over HTTP.
 * Reads its configuration once at startup and wires every component by constructor.
 */
public class SdaMcpServer {
    private static final Logger log = LoggerFactory.getLogger(SdaMcpServer.class);

    // Core components
    private final ServerConfig config;
    private final McpServerManager serverManager;
    private final TelemetryLogger telemetryLogger;
    private ApiHandlerRegistry apiHandlerRegistry;

    // Service instances
    private AccessionService accessionService;
    private SubjectService subjectService;

    public SdaMcpServer(ServerConfig config) {
        this.config = config;
        this.serverManager = new McpServerManager(config);
        this.telemetryLogger = config.telemetryEnabled()
            ? new TelemetryLogger(config.telemetryDir())
            : TelemetryLogger.disabled();
    }

    /**
     * Initialize all service instances
     */
    private void initializeServices() {
        final SdaClient client = new SdaClient(config);
        this.accessionService = new AccessionService(client);
        this.subjectService = new SubjectService(client);
        log.info("All services initialized against {}", config.baseUrl());
    }

    /**
     * Build the tool registry, bind the HTTP server and start serving.
     *
     * @throws IOException if the configured address cannot be bound
     */
    public void start() throws IOException {
        initializeServices();
        apiHandlerRegistry = new ApiHandlerRegistry(telemetryLogger, accessionService, subjectService);

        apiHandlerRegistry.registerAllEndpoints(serverManager.createServer());
        telemetryLogger.init();
        serverManager.startServer();
    }

    public void stop() {
        serverManager.stopServer();
        telemetryLogger.shutdown();
    }

    public McpServerManager getServerManager() {
        return serverManager;
    }

    public static void main(String[] args) {
        final ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println("sda-mcp-server: " + e.getMessage());
            System.err.println("Usage: sda-mcp-server --api-key KEY [--base-url URL] [--bind-address ADDR] [--port N]"
                + " [--request-timeout-seconds N] [--telemetry-dir DIR] [--no-telemetry]");
            System.exit(2);
            return;
        }
        log.info("Starting with {}", config);

        final SdaMcpServer server = new SdaMcpServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start HTTP server on {}:{}", config.bindAddress(), config.port(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "sda-mcp-shutdown"));
    }
}
