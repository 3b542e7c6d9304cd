package org.sudandigitalarchive.mcp.model;

/**
 * Output for mutation operations that return no data beyond a confirmation.
 */
public record StatusOutput(boolean success, String message) implements ToolOutput {

    /** Convenience factory for a successful result. */
    public static StatusOutput ok(String message) {
        return new StatusOutput(true, message);
    }

    @Override
    public Object toStructuredContent() {
        return this;
    }

    @Override
    public String toDisplayText() {
        return message;
    }
}
