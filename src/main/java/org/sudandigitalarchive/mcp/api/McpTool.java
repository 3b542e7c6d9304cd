package org.sudandigitalarchive.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.sudandigitalarchive.mcp.model.ToolOutput;

/**
 * Marks a service method as an MCP tool.
 * Annotated methods are discovered by reflection at startup; the camelCase method name
 * becomes the snake_case tool name unless overridden. Every tool is invoked by POST.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {
    /** Override tool name (empty = derive from method name via Json.toSnakeCase). */
    String name() default "";

    /** Tool description text. A Parameters: section is auto-appended from @Param annotations. */
    String description();

    /** Output type for this tool, used for the outputSchema when there is no response record. */
    Class<? extends ToolOutput> outputType() default ToolOutput.class;

    /** Response record type used to derive outputSchema. Void.class means no typed schema. */
    Class<?> responseType() default Void.class;
}
