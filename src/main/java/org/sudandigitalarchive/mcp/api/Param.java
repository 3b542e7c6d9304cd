package org.sudandigitalarchive.mcp.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotates a parameter of an @McpTool method with its description and its "unspecified" sentinel.
 * <p>
 * A parameter with a sentinel may be left out of the arguments; the sentinel is bound in its place.
 * Sentinels are written in the parameter's own terms: {@code "-1"} for numbers, {@code ""} for strings,
 * {@code "[]"} for lists and {@code "false"} for flags.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {
    /** Marker meaning the parameter has no sentinel and must always be supplied. */
    String NONE = "\0__REQUIRED__";

    /** Parameter description shown to MCP clients. */
    String value();

    /** Value standing for "not specified", or {@link #NONE} if the parameter is required. */
    String unset() default NONE;
}
