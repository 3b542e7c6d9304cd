package org.sudandigitalarchive.mcp.api;

import java.util.Map;

import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.model.ToolResult;
import org.sudandigitalarchive.mcp.normalize.ValidationException;

/**
 * Maps tool outcomes onto the {@link ToolResult} envelope.
 * Both methods are total: whatever a handler produces or throws becomes a well-formed result.
 */
public final class ToolResultFormatter {

    /** Failure categories reported in {@code structuredContent.error.kind}. */
    public enum ErrorKind {
        VALIDATION,
        TRANSPORT,
        REMOTE_STATUS,
        DECODE,
        INTERNAL
    }

    /**
     * Structured error payload.
     *
     * @param status remote HTTP status, only for {@link ErrorKind#REMOTE_STATUS}
     */
    public record ToolError(ErrorKind kind, String message, Integer status) {}

    private ToolResultFormatter() {}

    public static ToolResult success(final ToolOutput output) {
        return ToolResult.success(output.toDisplayText(), output.toStructuredContent());
    }

    public static ToolResult failure(final Throwable error) {
        final ErrorKind kind = classify(error);
        final String message = messageOf(error);
        final Integer status = error instanceof ApiException api && api.getStatusCode().isPresent()
            ? api.getStatusCode().getAsInt()
            : null;

        final String text = switch (kind) {
            case VALIDATION -> "Invalid arguments: " + message;
            case TRANSPORT -> "Archive request failed: " + message;
            case REMOTE_STATUS -> "Archive returned HTTP " + status + ": " + message;
            case DECODE -> "Unexpected response from the archive: " + message;
            case INTERNAL -> "Internal error: " + message;
        };
        return ToolResult.error(text, Map.of("error", new ToolError(kind, message, status)));
    }

    public static ErrorKind classify(final Throwable error) {
        if (error instanceof ValidationException) return ErrorKind.VALIDATION;
        if (error instanceof ApiException api) {
            return switch (api.getOrigin()) {
                case TRANSPORT -> ErrorKind.TRANSPORT;
                case HTTP_STATUS -> ErrorKind.REMOTE_STATUS;
                case DECODE -> ErrorKind.DECODE;
            };
        }
        return ErrorKind.INTERNAL;
    }

    private static String messageOf(final Throwable error) {
        final String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
