package org.sudandigitalarchive.mcp.model;

/**
 * Sealed interface for typed MCP tool outputs.
 * Each subtype defines its own structured content and display text format.
 */
public sealed interface ToolOutput permits JsonOutput, StatusOutput {

    /** Return the structured value placed in the result envelope. */
    Object toStructuredContent();

    /** Return the human-readable display text. */
    String toDisplayText();

    /**
     * Return the JSON Schema for the given ToolOutput subtype.
     * Used by /mcp/tools when a tool declares no response record.
     */
    static String schemaFor(Class<? extends ToolOutput> type) {
        if (type == StatusOutput.class) {
            return "{\"type\": \"object\", \"properties\": {"
                + "\"success\": {\"type\": \"boolean\"}, "
                + "\"message\": {\"type\": \"string\"}"
                + "}, \"required\": [\"success\", \"message\"]}";
        }
        return "{\"type\": \"object\"}";
    }
}
