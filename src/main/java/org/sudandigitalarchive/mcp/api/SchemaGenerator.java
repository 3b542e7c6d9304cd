package org.sudandigitalarchive.mcp.api;

import org.sudandigitalarchive.mcp.model.StatusOutput;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfig;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;

/**
 * Generates JSON Schema strings from Java record types using victools/jsonschema-generator.
 * Used to derive outputSchema for /mcp/tools at runtime.
 */
public final class SchemaGenerator {
    private static final com.github.victools.jsonschema.generator.SchemaGenerator GENERATOR;

    static {
        final JacksonModule jacksonModule = new JacksonModule(
            JacksonOption.RESPECT_JSONPROPERTY_REQUIRED, JacksonOption.FLATTENED_ENUMS_FROM_JSONVALUE);
        final SchemaGeneratorConfigBuilder configBuilder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(jacksonModule)
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT);
        // Apply snake_case naming to schema properties to match Jackson serialization
        configBuilder.forFields()
            .withPropertyNameOverrideResolver(field ->
                Json.toSnakeCase(field.getDeclaredName()));
        final SchemaGeneratorConfig config = configBuilder.build();
        GENERATOR = new com.github.victools.jsonschema.generator.SchemaGenerator(config);
    }

    private SchemaGenerator() {}

    /**
     * Generate a JSON Schema string for a tool's structured content.
     *
     * @param responseType the record type (or Void.class when the tool has none)
     * @param outputType   the ToolOutput subtype the tool returns
     * @return JSON Schema string, or null if nothing is known about the output shape
     */
    public static String generateSchema(final Class<?> responseType, final Class<? extends ToolOutput> outputType) {
        if (responseType == Void.class || responseType == void.class) {
            return outputType == StatusOutput.class ? ToolOutput.schemaFor(StatusOutput.class) : null;
        }

        final ObjectNode schema = GENERATOR.generateSchema(responseType);
        return schema.toString();
    }
}
