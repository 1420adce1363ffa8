package com.dburyak.proxybase.mcp.tools;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP tool as advertised by {@code tools/list}. Immutable: the schema is only handed out as a copy.
 */
@Value
public class ToolDefinition {
    public static final String FIELD_NAME = "name";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_INPUT_SCHEMA = "inputSchema";

    String name;
    String description;
    JsonObject inputSchema;

    public ToolDefinition(String name, String description, JsonObject inputSchema) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("tool name must be provided");
        }
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema.copy();
    }

    public JsonObject getInputSchema() {
        return inputSchema.copy();
    }

    public List<String> getRequiredArguments() {
        return inputSchema.getJsonArray("required").stream()
                .map(Object::toString)
                .toList();
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put(FIELD_NAME, name)
                .put(FIELD_DESCRIPTION, description)
                .put(FIELD_INPUT_SCHEMA, inputSchema.copy());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builds a tool whose input schema is an object of string properties.
     */
    public static class Builder {
        private final String name;
        private String description;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredString(String propName, String propDescription) {
            properties.put(propName, propDescription);
            required.add(propName);
            return this;
        }

        public Builder optionalString(String propName, String propDescription) {
            properties.put(propName, propDescription);
            return this;
        }

        public ToolDefinition build() {
            var props = new JsonObject();
            properties.forEach((propName, propDescription) -> props.put(propName, new JsonObject()
                    .put("type", "string")
                    .put("description", propDescription)));
            var schema = new JsonObject()
                    .put("type", "object")
                    .put("properties", props)
                    .put("required", new JsonArray(new ArrayList<>(required)));
            return new ToolDefinition(name, description, schema);
        }
    }
}
