package org.sudandigitalarchive.mcp.api;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.normalize.ValidationException;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runtime tool definition built from an @McpTool-annotated method via reflection.
 * Holds all metadata needed to bind arguments, invoke the handler and serve MCP tool schemas.
 */
public class ToolDef {
    private final String name;              // snake_case tool name
    private final String description;       // full description including auto-generated Parameters section
    private final List<ToolParamDef> params;
    private final Class<? extends ToolOutput> outputType;
    private final Class<?> responseType;    // response record type for schema generation
    private final Object target;
    private final Method method;

    private ToolDef(final String name, final String rawDescription, final List<ToolParamDef> params,
                    final Class<? extends ToolOutput> outputType, final Class<?> responseType,
                    final Object target, final Method method) {
        this.name = name;
        this.params = params;
        this.outputType = outputType;
        this.responseType = responseType;
        this.target = target;
        this.method = method;
        this.description = buildFullDescription(rawDescription, params);
    }

    /**
     * Build a ToolDef from an annotated method using reflection.
     *
     * @param target the service instance the method is invoked on
     * @throws IllegalStateException if the method does not return a ToolOutput or a parameter lacks @Param
     */
    public static ToolDef fromMethod(final Object target, final Method method, final McpTool annotation) {
        final String toolName = annotation.name().isEmpty()
            ? Json.toSnakeCase(method.getName())
            : annotation.name();

        if (!ToolOutput.class.isAssignableFrom(method.getReturnType())) {
            throw new IllegalStateException("Tool " + toolName + " must return a ToolOutput");
        }

        final Parameter[] javaParams = method.getParameters();
        final java.lang.reflect.Type[] genericTypes = method.getGenericParameterTypes();

        final List<ToolParamDef> paramDefs = new ArrayList<>();
        for (int i = 0; i < javaParams.length; i++) {
            final Param paramAnn = javaParams[i].getAnnotation(Param.class);
            if (paramAnn == null) {
                throw new IllegalStateException("Parameter " + javaParams[i].getName() + " of tool " + toolName
                    + " has no @Param annotation");
            }

            final String paramName = Json.toSnakeCase(javaParams[i].getName());
            final ParamType paramType = ParamType.inferFrom(genericTypes[i]);
            final boolean required = paramAnn.unset().equals(Param.NONE);
            final Object unsetValue = required ? null : paramType.parseUnset(paramAnn.unset());

            paramDefs.add(new ToolParamDef(paramName, paramType, required, unsetValue, paramAnn.value()));
        }

        return new ToolDef(toolName, annotation.description(), List.copyOf(paramDefs),
            annotation.outputType(), annotation.responseType(), target, method);
    }

    /**
     * Bind a JSON argument object to the handler's parameters, in declaration order.
     * Omitted or null arguments take their sentinel; unknown argument names are ignored.
     *
     * @throws ValidationException for a non-object argument value, a missing required parameter or a type mismatch
     */
    public Object[] bindArguments(final JsonNode arguments) {
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            throw new ValidationException("arguments", "must be a JSON object");
        }

        final Object[] values = new Object[params.size()];
        for (int i = 0; i < params.size(); i++) {
            final ToolParamDef p = params.get(i);
            final JsonNode node = arguments == null ? null : arguments.get(p.name());
            if (node == null || node.isNull()) {
                if (p.required()) throw new ValidationException(p.name(), "is required");
                values[i] = p.unsetValue();
            } else {
                values[i] = p.type().bind(p.name(), node);
            }
        }
        return values;
    }

    /**
     * Bind the arguments and run the handler.
     *
     * @throws ApiException when the archive call fails
     * @throws ValidationException when the arguments are rejected
     */
    public ToolOutput invoke(final JsonNode arguments) throws ApiException {
        final Object[] values = bindArguments(arguments);
        try {
            return (ToolOutput) method.invoke(target, values);
        } catch (InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ApiException apiException) throw apiException;
            if (cause instanceof RuntimeException runtimeException) throw runtimeException;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Tool " + name + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Tool " + name + " is not accessible", e);
        }
    }

    /**
     * Names of the arguments actually supplied, in the order the handler declares them.
     */
    public List<String> suppliedParameterNames(final JsonNode arguments) {
        if (arguments == null || !arguments.isObject()) return List.of();
        final List<String> names = new ArrayList<>();
        for (final Iterator<String> it = arguments.fieldNames(); it.hasNext(); ) {
            final String field = it.next();
            if (params.stream().anyMatch(p -> p.name().equals(field))) names.add(field);
        }
        return names;
    }

    /**
     * Build the /mcp/tools listing entry for this tool.
     */
    public Map<String, Object> toToolMap() {
        final Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", buildInputSchemaMap());

        final String schema = SchemaGenerator.generateSchema(responseType, outputType);
        if (schema != null) {
            tool.put("outputSchema", Json.readValue(schema, Object.class));
        }
        return tool;
    }

    /**
     * Build the input schema as a Map for Jackson serialization.
     * Every parameter is listed as required: callers pass the sentinel to mean "not specified".
     */
    private Map<String, Object> buildInputSchemaMap() {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");

        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final ToolParamDef p : params) {
            properties.put(p.name(), p.type().toJsonSchemaMap(p.description(), p.unsetValue()));
        }
        schema.put("properties", properties);
        schema.put("required", params.stream().map(ToolParamDef::name).toList());
        return schema;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<ToolParamDef> getParams() { return params; }

    private static String buildFullDescription(final String rawDescription, final List<ToolParamDef> params) {
        if (params.isEmpty()) return rawDescription;

        final StringBuilder sb = new StringBuilder(rawDescription);
        sb.append("\n\n    Parameters:\n");
        for (final ToolParamDef p : params) {
            sb.append("        ").append(p.name()).append(": ").append(p.description());
            if (!p.required()) {
                sb.append(" (unspecified: ").append(Json.serialize(p.unsetValue())).append(")");
            }
            sb.append("\n");
        }
        return sb.toString().stripTrailing();
    }
}
