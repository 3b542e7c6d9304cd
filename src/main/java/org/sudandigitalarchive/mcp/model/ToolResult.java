package org.sudandigitalarchive.mcp.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The envelope returned for every tool invocation, success or failure.
 * Field names follow the MCP CallToolResult shape rather than the snake_case used elsewhere.
 */
public record ToolResult(
    @JsonProperty("content") List<Content> content,
    @JsonProperty("structuredContent") Object structuredContent,
    @JsonProperty("isError") boolean isError
) {
    public ToolResult {
        content = List.copyOf(content);
    }

    /** A single text content block. */
    public record Content(@JsonProperty("type") String type, @JsonProperty("text") String text) {
        public static Content text(String text) {
            return new Content("text", text);
        }
    }

    public static ToolResult success(String text, Object structuredContent) {
        return new ToolResult(List.of(Content.text(text)), structuredContent, false);
    }

    public static ToolResult error(String text, Object structuredContent) {
        return new ToolResult(List.of(Content.text(text)), structuredContent, true);
    }

    /** Text of the first content block. */
    public String text() {
        return content.isEmpty() ? "" : content.get(0).text();
    }
}
