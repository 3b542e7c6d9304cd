package org.sudandigitalarchive.mcp.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.model.JsonOutput;
import org.sudandigitalarchive.mcp.model.StatusOutput;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.model.response.Subject;
import org.sudandigitalarchive.mcp.normalize.ValidationException;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.databind.JsonNode;

class ToolDefTest {

    // Test helper class with annotated methods
    @SuppressWarnings("unused")
    public static class TestTools {
        @McpTool(description = "Fetch a thing", outputType = JsonOutput.class, responseType = Subject.class)
        public ToolOutput getThing(
                @Param("Thing id") String thingId,
                @Param(value = "Page number", unset = "-1") int page,
                @Param(value = "Tags", unset = "[]") List<String> tags,
                @Param(value = "Include hidden", unset = "false") boolean includeHidden) {
            return StatusOutput.ok(thingId + ":" + page + ":" + tags + ":" + includeHidden);
        }

        @McpTool(name = "custom_name", description = "Tool with custom name", outputType = StatusOutput.class)
        public ToolOutput myCustomTool() {
            return StatusOutput.ok("custom");
        }

        @McpTool(description = "Always fails remotely")
        public ToolOutput failRemotely() throws ApiException {
            throw ApiException.httpStatus(500, "boom");
        }

        @McpTool(description = "Not a tool output")
        public String wrongReturnType() {
            return "x";
        }

        @McpTool(description = "Missing @Param")
        public ToolOutput missingParam(String value) {
            return StatusOutput.ok(value);
        }
    }

    private static ToolDef toolFor(String methodName, Class<?>... types) throws Exception {
        final Method method = TestTools.class.getMethod(methodName, types);
        return ToolDef.fromMethod(new TestTools(), method, method.getAnnotation(McpTool.class));
    }

    private static ToolDef getThing() throws Exception {
        return toolFor("getThing", String.class, int.class, List.class, boolean.class);
    }

    // =========================================================================
    // fromMethod tests
    // =========================================================================

    @Test
    void testFromMethod_WithParams() throws Exception {
        final ToolDef def = getThing();

        assertEquals("get_thing", def.getName());
        assertEquals(4, def.getParams().size());

        final ToolParamDef id = def.getParams().get(0);
        assertEquals("thing_id", id.name());
        assertEquals(ParamType.STRING, id.type());
        assertTrue(id.required());
        assertNull(id.unsetValue());

        final ToolParamDef page = def.getParams().get(1);
        assertEquals("page", page.name());
        assertFalse(page.required());
        assertEquals(-1, page.unsetValue());

        assertEquals(ParamType.STRING_LIST, def.getParams().get(2).type());
        assertEquals(List.of(), def.getParams().get(2).unsetValue());
        assertEquals(false, def.getParams().get(3).unsetValue());
    }

    @Test
    void testFromMethod_CustomName() throws Exception {
        assertEquals("custom_name", toolFor("myCustomTool").getName());
    }

    @Test
    void testFromMethod_RejectsNonToolOutput() {
        assertThrows(IllegalStateException.class, () -> toolFor("wrongReturnType"));
    }

    @Test
    void testFromMethod_RejectsParameterWithoutAnnotation() {
        assertThrows(IllegalStateException.class, () -> toolFor("missingParam", String.class));
    }

    @Test
    void testDescription_IncludesParametersSection() throws Exception {
        final String description = getThing().getDescription();

        assertTrue(description.startsWith("Fetch a thing"));
        assertTrue(description.contains("Parameters:"));
        assertTrue(description.contains("thing_id: Thing id"));
        assertTrue(description.contains("page: Page number (unspecified: -1)"));
        assertTrue(description.contains("tags: Tags (unspecified: [])"));
    }

    // =========================================================================
    // Argument binding
    // =========================================================================

    @Test
    void testBindArguments_OmittedSentinelParamsTakeSentinel() throws Exception {
        final Object[] values = getThing().bindArguments(Json.readTree("{\"thing_id\": \"t1\"}"));

        assertArrayEquals(new Object[] {"t1", -1, List.of(), false}, values);
    }

    @Test
    void testBindArguments_NullTreatedAsOmitted() throws Exception {
        final Object[] values = getThing().bindArguments(Json.readTree("{\"thing_id\": \"t1\", \"page\": null}"));

        assertEquals(-1, values[1]);
    }

    @Test
    void testBindArguments_MissingRequired() throws Exception {
        final ValidationException e = assertThrows(ValidationException.class,
            () -> getThing().bindArguments(Json.readTree("{\"page\": 2}")));
        assertEquals("thing_id", e.getParameter());
    }

    @Test
    void testBindArguments_TypeMismatch() throws Exception {
        final ValidationException e = assertThrows(ValidationException.class,
            () -> getThing().bindArguments(Json.readTree("{\"thing_id\": \"t1\", \"page\": \"2\"}")));
        assertEquals("page", e.getParameter());
    }

    @Test
    void testBindArguments_NonObjectRejected() throws Exception {
        assertThrows(ValidationException.class, () -> getThing().bindArguments(Json.readTree("[1]")));
    }

    @Test
    void testInvoke_PassesBoundValues() throws Exception {
        final ToolOutput output = getThing().invoke(
            Json.readTree("{\"thing_id\": \"t1\", \"page\": 3, \"tags\": [\"a\"], \"include_hidden\": true, \"extra\": 1}"));

        assertEquals("t1:3:[a]:true", output.toDisplayText());
    }

    @Test
    void testInvoke_UnwrapsApiException() throws Exception {
        final ApiException e = assertThrows(ApiException.class, () -> toolFor("failRemotely").invoke(Json.createObject()));

        assertEquals(500, e.getStatusCode().getAsInt());
    }

    @Test
    void testSuppliedParameterNames_IgnoresUnknownKeys() throws Exception {
        final JsonNode args = Json.readTree("{\"page\": 1, \"thing_id\": \"x\", \"secret\": \"y\"}");

        assertEquals(List.of("page", "thing_id"), getThing().suppliedParameterNames(args));
    }

    // =========================================================================
    // Schema generation
    // =========================================================================

    @Test
    @SuppressWarnings("unchecked")
    void testToToolMap_EveryParamRequiredInSchema() throws Exception {
        final Map<String, Object> tool = getThing().toToolMap();
        final Map<String, Object> inputSchema = (Map<String, Object>) tool.get("inputSchema");

        assertEquals("get_thing", tool.get("name"));
        assertEquals(List.of("thing_id", "page", "tags", "include_hidden"), inputSchema.get("required"));

        final Map<String, Object> properties = (Map<String, Object>) inputSchema.get("properties");
        assertEquals(-1, ((Map<String, Object>) properties.get("page")).get("default"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToToolMap_OutputSchemaFromResponseRecord() throws Exception {
        final Map<String, Object> outputSchema = (Map<String, Object>) getThing().toToolMap().get("outputSchema");
        final Map<String, Object> properties = (Map<String, Object>) outputSchema.get("properties");

        assertTrue(properties.containsKey("id"));
        assertTrue(properties.containsKey("label"));
        assertTrue(((List<String>) outputSchema.get("required")).contains("id"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToToolMap_StatusOutputFallbackSchema() throws Exception {
        final Map<String, Object> outputSchema = (Map<String, Object>) toolFor("myCustomTool").toToolMap().get("outputSchema");

        assertEquals(List.of("success", "message"), outputSchema.get("required"));
    }

    @Test
    void testToToolMap_NoOutputSchemaWithoutTypeInfo() throws Exception {
        assertFalse(toolFor("failRemotely").toToolMap().containsKey("outputSchema"));
    }

    @Test
    void testGetParams_Immutable() throws Exception {
        final ToolDef def = getThing();
        assertSame(def.getParams(), def.getParams());
        assertThrows(UnsupportedOperationException.class, () -> def.getParams().clear());
    }
}
