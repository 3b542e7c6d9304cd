package org.sudandigitalarchive.mcp.api;

/**
 * Runtime definition of a single tool parameter, built from @Param annotation + reflection.
 */
public record ToolParamDef(
    String name,           // snake_case parameter name
    ParamType type,        // inferred from Java type
    boolean required,      // true if no sentinel declared
    Object unsetValue,     // parsed sentinel, or null when required
    String description     // from @Param.value()
) {}
