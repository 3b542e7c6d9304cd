package org.sudandigitalarchive.mcp.model;

import org.sudandigitalarchive.mcp.utils.Json;

/**
 * Output for tools that return structured data via record objects.
 * The data object is serialized to JSON via Jackson.
 */
public record JsonOutput(Object data) implements ToolOutput {

    @Override
    public Object toStructuredContent() {
        return data;
    }

    @Override
    public String toDisplayText() {
        if (data instanceof Displayable d) {
            return d.toDisplayText();
        }
        return Json.prettyPrint(data);
    }
}
