package org.sudandigitalarchive.mcp.api;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.model.ToolResult;
import org.sudandigitalarchive.mcp.normalize.ValidationException;
import org.sudandigitalarchive.mcp.telemetry.TelemetryLogger;
import org.sudandigitalarchive.mcp.utils.HttpUtils;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Registration table and dispatcher for all tools.
 * <p>
 * Scans the given service objects for {@link McpTool} methods once, at construction, and
 * afterwards only reads the table, so it is safe to share across handler threads.
 * Every invocation runs bind, normalize, call, format and ends in a {@link ToolResult}.
 */
public class ApiHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlerRegistry.class);

    static final String TOOLS_ENDPOINT = "/mcp/tools";
    static final String CALL_ENDPOINT = "/mcp/call";

    private final Map<String, ToolDef> tools;
    private final TelemetryLogger telemetryLogger;
    private final String toolListingJson;

    /**
     * Creates a new ApiHandlerRegistry
     *
     * @param telemetryLogger the telemetry sink for tool invocations
     * @param services objects whose @McpTool methods become tools
     * @throws IllegalStateException if two methods declare the same tool name
     */
    public ApiHandlerRegistry(TelemetryLogger telemetryLogger, Object... services) {
        this.telemetryLogger = telemetryLogger;
        this.tools = Collections.unmodifiableMap(scan(services));

        final List<Map<String, Object>> listing = new ArrayList<>();
        for (ToolDef tool : tools.values()) {
            listing.add(tool.toToolMap());
        }
        this.toolListingJson = Json.serialize(Map.of("tools", listing));
        log.info("Registered {} tools: {}", tools.size(), tools.keySet());
    }

    private static Map<String, ToolDef> scan(Object[] services) {
        final Map<String, ToolDef> table = new LinkedHashMap<>();
        for (Object service : services) {
            final List<Method> methods = new ArrayList<>();
            for (Method method : service.getClass().getMethods()) {
                if (method.isAnnotationPresent(McpTool.class)) methods.add(method);
            }
            // getMethods() order is unspecified
            methods.sort((a, b) -> a.getName().compareTo(b.getName()));

            for (Method method : methods) {
                final ToolDef tool = ToolDef.fromMethod(service, method, method.getAnnotation(McpTool.class));
                final ToolDef existing = table.putIfAbsent(tool.getName(), tool);
                if (existing != null) {
                    throw new IllegalStateException("Duplicate tool name: " + tool.getName());
                }
            }
        }
        return table;
    }

    public Collection<ToolDef> getTools() {
        return tools.values();
    }

    public Optional<ToolDef> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * JSON body served by /mcp/tools.
     */
    public String getToolListingJson() {
        return toolListingJson;
    }

    /**
     * Invoke a tool by name. An unknown name is a validation failure.
     */
    public ToolResult invoke(String name, JsonNode arguments) {
        final ToolDef tool = tools.get(name);
        if (tool == null) {
            return ToolResultFormatter.failure(new ValidationException("name", "Unknown tool: " + name));
        }
        return invoke(tool, arguments);
    }

    /**
     * Run one tool invocation. Never throws: every failure becomes an error result.
     */
    public ToolResult invoke(ToolDef tool, JsonNode arguments) {
        final String endpoint = "/" + tool.getName();
        final long startTime = telemetryLogger.logToolStart(tool.getName(), endpoint, tool.suppliedParameterNames(arguments));
        try {
            final ToolResult result = ToolResultFormatter.success(tool.invoke(arguments));
            telemetryLogger.logToolSuccess(tool.getName(), endpoint, startTime, result.text().length());
            return result;
        } catch (ValidationException e) {
            log.debug("{} rejected arguments: {}", tool.getName(), e.getMessage());
            return fail(tool, endpoint, startTime, e);
        } catch (ApiException e) {
            log.warn("{} failed ({}): {}", tool.getName(), e.getOrigin(), e.getMessage());
            return fail(tool, endpoint, startTime, e);
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", tool.getName(), e);
            return fail(tool, endpoint, startTime, e);
        }
    }

    private ToolResult fail(ToolDef tool, String endpoint, long startTime, Exception e) {
        final ToolResult result = ToolResultFormatter.failure(e);
        telemetryLogger.logToolFailure(tool.getName(), endpoint, startTime,
            ToolResultFormatter.classify(e).name(), result.text());
        return result;
    }

    /**
     * Register all API endpoints with the server
     */
    public void registerAllEndpoints(HttpServer server) {
        for (ToolDef tool : tools.values()) {
            registerEndpoint(server, "/" + tool.getName(), "POST", exchange -> {
                final JsonNode arguments = readJsonBody(exchange);
                if (arguments == null) return;
                sendResult(exchange, invoke(tool, arguments));
            });
        }

        registerEndpoint(server, TOOLS_ENDPOINT, "GET",
            exchange -> HttpUtils.sendJson(exchange, 200, toolListingJson));

        registerEndpoint(server, CALL_ENDPOINT, "POST", exchange -> {
            final JsonNode body = readJsonBody(exchange);
            if (body == null) return;

            final JsonNode name = body.get("name");
            if (name == null || !name.isTextual()) {
                HttpUtils.sendError(exchange, 400, "Request body must be {\"name\": ..., \"arguments\": {...}}");
                return;
            }
            final ToolDef tool = tools.get(name.textValue());
            if (tool == null) {
                HttpUtils.sendError(exchange, 404, "Unknown tool: " + name.textValue());
                return;
            }
            sendResult(exchange, invoke(tool, body.get("arguments")));
        });

        log.info("All API endpoints registered successfully");
    }

    /**
     * Register a handler for one exact path and method. Anything else on the path is 404 or 405.
     */
    private void registerEndpoint(HttpServer server, String endpoint, String method, HttpHandler handler) {
        server.createContext(endpoint, exchange -> {
            try {
                if (!exchange.getRequestURI().getPath().equals(endpoint)) {
                    HttpUtils.sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
                } else if (!exchange.getRequestMethod().equalsIgnoreCase(method)) {
                    exchange.getResponseHeaders().set("Allow", method);
                    HttpUtils.sendError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed, use " + method);
                } else {
                    handler.handle(exchange);
                }
            } catch (RuntimeException e) {
                log.error("Unhandled error serving {}", endpoint, e);
                HttpUtils.sendError(exchange, 500, "Internal server error");
            } finally {
                exchange.close();
            }
        });
    }

    /**
     * Parse the request body as a JSON object, answering 400 and returning null if it is not one.
     * An empty body is an empty argument object.
     */
    private static JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        final String body = HttpUtils.readBody(exchange);
        if (body.isBlank()) return Json.createObject();

        final JsonNode node;
        try {
            node = Json.decode(body, JsonNode.class);
        } catch (JsonProcessingException e) {
            HttpUtils.sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
            return null;
        }
        if (!node.isObject()) {
            HttpUtils.sendError(exchange, 400, "Request body must be a JSON object");
            return null;
        }
        return node;
    }

    private static void sendResult(HttpExchange exchange, ToolResult result) throws IOException {
        HttpUtils.sendJson(exchange, 200, Json.serialize(result));
    }
}
