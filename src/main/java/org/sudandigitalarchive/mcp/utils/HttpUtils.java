package org.sudandigitalarchive.mcp.utils;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.sun.net.httpserver.HttpExchange;

/**
 * Utility methods for HTTP operations on both sides of the bridge:
 * the inbound tool endpoints and the outbound archive requests.
 */
public class HttpUtils {
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
        Map.entry(400, "Bad Request"),
        Map.entry(401, "Unauthorized"),
        Map.entry(403, "Forbidden"),
        Map.entry(404, "Not Found"),
        Map.entry(405, "Method Not Allowed"),
        Map.entry(409, "Conflict"),
        Map.entry(422, "Unprocessable Entity"),
        Map.entry(429, "Too Many Requests"),
        Map.entry(500, "Internal Server Error"),
        Map.entry(502, "Bad Gateway"),
        Map.entry(503, "Service Unavailable"),
        Map.entry(504, "Gateway Timeout")
    );

    /**
     * Build an encoded query string ("?a=1&b=2") from ordered key/value pairs.
     * Returns an empty string when there are no pairs, so absent parameters leave no trace in the URL.
     */
    public static String buildQueryString(List<Map.Entry<String, String>> params) {
        if (params == null || params.isEmpty()) return "";

        return params.stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&", "?", ""));
    }

    /**
     * Encode a value for use as a single URL path segment.
     */
    public static String encodePathSegment(String segment) {
        return encode(segment).replace("+", "%20");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Read the request body as UTF-8 text.
     */
    public static String readBody(HttpExchange exchange) throws IOException {
        try (var in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Status line used when a remote error body carries no usable message, e.g. "HTTP 404 Not Found".
     */
    public static String statusLine(int statusCode) {
        var reason = REASON_PHRASES.get(statusCode);
        return reason == null ? "HTTP " + statusCode : "HTTP " + statusCode + " " + reason;
    }

    /**
     * Send a JSON HTTP response
     */
    public static void sendJson(HttpExchange exchange, int status, String json) throws IOException {
        var bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Send a JSON error body of the form {"error": "..."}.
     */
    public static void sendError(HttpExchange exchange, int status, String message) throws IOException {
        sendJson(exchange, status, Json.serialize(Map.of("error", message)));
    }

    /**
     * Truncate text for log lines and error messages.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null) return null;
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }
}
