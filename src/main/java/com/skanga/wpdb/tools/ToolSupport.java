package com.skanga.wpdb.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.config.ResourceManager;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Argument parsing and tool definition building shared by the tool classes.
 * Every parsing method throws {@link IllegalArgumentException} for a missing, ill-typed or out of range
 * argument, which the server reports as an invalid params error.
 */
public final class ToolSupport {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final int DEFAULT_LIMIT = 100;

    private ToolSupport() {
    }

    public static String requiredString(JsonNode argsNode, String argName, int maxLength) {
        String argValue = optionalString(argsNode, argName, maxLength);
        if (argValue == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", argName));
        }
        return argValue;
    }

    /**
     * Reads a required string argument exactly as sent. Blank values count as missing.
     */
    public static String requiredRawString(JsonNode argsNode, String argName, int maxLength) {
        JsonNode argNode = argsNode.path(argName);
        if (argNode.isMissingNode() || argNode.isNull()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", argName));
        }
        if (!argNode.isTextual()) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.type", argName, "string"));
        }
        String argValue = argNode.asText();
        if (argValue.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", argName));
        }
        if (argValue.length() > maxLength) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.too.long", argName, maxLength));
        }
        return argValue;
    }

    /**
     * Reads a trimmed string argument; absent, null and blank values all come back as null.
     */
    public static String optionalString(JsonNode argsNode, String argName, int maxLength) {
        JsonNode argNode = argsNode.path(argName);
        if (argNode.isMissingNode() || argNode.isNull()) {
            return null;
        }
        if (!argNode.isTextual()) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.type", argName, "string"));
        }
        String argValue = argNode.asText().trim();
        if (argValue.isEmpty()) {
            return null;
        }
        if (argValue.length() > maxLength) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.too.long", argName, maxLength));
        }
        return argValue;
    }

    /**
     * Reads a required WordPress object id (post, term, user or comment id), which must be at least 1.
     */
    public static long requiredId(JsonNode argsNode, String argName) {
        Long argValue = optionalLong(argsNode, argName);
        if (argValue == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", argName));
        }
        if (argValue < 1) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.range", argName, 1, Long.MAX_VALUE));
        }
        return argValue;
    }

    /**
     * Reads {@code site_id}. Values of 1 or below address the main site.
     */
    public static Integer optionalSiteId(JsonNode argsNode) {
        Long siteId = optionalLong(argsNode, "site_id");
        if (siteId == null) {
            return null;
        }
        if (siteId > Integer.MAX_VALUE || siteId < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.range", "site_id", 1, Integer.MAX_VALUE));
        }
        return siteId.intValue();
    }

    /**
     * Reads {@code limit}, defaulting to {@link #DEFAULT_LIMIT} capped by the configured maximum.
     */
    public static int limit(JsonNode argsNode, int maxRows) {
        Long limitValue = optionalLong(argsNode, "limit");
        if (limitValue == null) {
            return Math.min(DEFAULT_LIMIT, maxRows);
        }
        if (limitValue < 1 || limitValue > maxRows) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.range", "limit", 1, maxRows));
        }
        return limitValue.intValue();
    }

    public static boolean optionalBoolean(JsonNode argsNode, String argName, boolean defaultValue) {
        JsonNode argNode = argsNode.path(argName);
        if (argNode.isMissingNode() || argNode.isNull()) {
            return defaultValue;
        }
        if (argNode.isBoolean()) {
            return argNode.booleanValue();
        }
        if (argNode.isTextual() && ("true".equalsIgnoreCase(argNode.asText()) || "false".equalsIgnoreCase(argNode.asText()))) {
            return Boolean.parseBoolean(argNode.asText());
        }
        throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.type", argName, "boolean"));
    }

    public static OutputFormat format(JsonNode argsNode) {
        return OutputFormat.fromArgument(optionalString(argsNode, "format", 10));
    }

    /**
     * Rejects arguments a tool does not declare.
     */
    public static void rejectUnknownArguments(JsonNode argsNode, ObjectNode toolDefinition) {
        if (!argsNode.isObject()) {
            if (argsNode.isMissingNode() || argsNode.isNull()) {
                return;
            }
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.arguments.not.object"));
        }
        JsonNode declared = toolDefinition.path("inputSchema").path("properties");
        Iterator<String> argNames = argsNode.fieldNames();
        while (argNames.hasNext()) {
            String argName = argNames.next();
            if (!declared.has(argName)) {
                throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.unknown", argName));
            }
        }
    }

    private static Long optionalLong(JsonNode argsNode, String argName) {
        JsonNode argNode = argsNode.path(argName);
        if (argNode.isMissingNode() || argNode.isNull()) {
            return null;
        }
        if (argNode.isIntegralNumber() && argNode.canConvertToLong()) {
            return argNode.longValue();
        }
        if (argNode.isTextual()) {
            try {
                return Long.parseLong(argNode.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        ResourceManager.getErrorMessage("tool.argument.type", argName, "integer"), e);
            }
        }
        throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.type", argName, "integer"));
    }

    /**
     * Starts a read-only tool definition with the standard annotations.
     */
    public static ToolDefinitionBuilder tool(String toolName, String title, String description) {
        return new ToolDefinitionBuilder(toolName, title, description);
    }

    /**
     * Builds the {@code tools/list} entry of one tool.
     */
    public static final class ToolDefinitionBuilder {
        private final ObjectNode toolNode = objectMapper.createObjectNode();
        private final ObjectNode propertiesNode = objectMapper.createObjectNode();
        private final Set<String> requiredArgs = new LinkedHashSet<>();

        private ToolDefinitionBuilder(String toolName, String title, String description) {
            toolNode.put("name", toolName);
            toolNode.put("title", title);
            toolNode.put("description", description);

            ObjectNode annotationsNode = objectMapper.createObjectNode();
            annotationsNode.put("title", title);
            annotationsNode.put("readOnlyHint", true);
            annotationsNode.put("destructiveHint", false);
            annotationsNode.put("idempotentHint", true);
            annotationsNode.put("openWorldHint", false);
            toolNode.set("annotations", annotationsNode);
        }

        public ToolDefinitionBuilder string(String argName, String description, int minLength, int maxLength,
                                            boolean required) {
            ObjectNode propertyNode = property("string", description);
            propertyNode.put("minLength", minLength);
            propertyNode.put("maxLength", maxLength);
            return add(argName, propertyNode, required);
        }

        public ToolDefinitionBuilder string(String argName, String description, String defaultValue, int maxLength) {
            ObjectNode propertyNode = property("string", description);
            propertyNode.put("maxLength", maxLength);
            if (defaultValue != null) {
                propertyNode.put("default", defaultValue);
            }
            return add(argName, propertyNode, false);
        }

        public ToolDefinitionBuilder id(String argName, String description) {
            ObjectNode propertyNode = property("integer", description);
            propertyNode.put("minimum", 1);
            return add(argName, propertyNode, true);
        }

        public ToolDefinitionBuilder siteId() {
            return add("site_id", property("integer",
                    "Multisite blog ID. Omit or use 1 for the main site, 2, 3, ... for sub-sites."), false);
        }

        public ToolDefinitionBuilder limit(int maxRows) {
            ObjectNode propertyNode = property("integer", "Maximum rows to return.");
            propertyNode.put("minimum", 1);
            propertyNode.put("maximum", maxRows);
            propertyNode.put("default", Math.min(DEFAULT_LIMIT, maxRows));
            return add("limit", propertyNode, false);
        }

        public ToolDefinitionBuilder bool(String argName, String description, boolean defaultValue) {
            ObjectNode propertyNode = property("boolean", description);
            propertyNode.put("default", defaultValue);
            return add(argName, propertyNode, false);
        }

        public ToolDefinitionBuilder format() {
            ObjectNode propertyNode = property("string", "Output format.");
            ArrayNode enumNode = propertyNode.putArray("enum");
            enumNode.add("json");
            enumNode.add("csv");
            propertyNode.put("default", "json");
            return add("format", propertyNode, false);
        }

        public ObjectNode build() {
            ObjectNode inputSchema = objectMapper.createObjectNode();
            inputSchema.put("type", "object");
            inputSchema.set("properties", propertiesNode);
            if (!requiredArgs.isEmpty()) {
                ArrayNode requiredNode = inputSchema.putArray("required");
                requiredArgs.forEach(requiredNode::add);
            }
            inputSchema.put("additionalProperties", false);
            toolNode.set("inputSchema", inputSchema);
            return toolNode;
        }

        private ObjectNode property(String type, String description) {
            ObjectNode propertyNode = objectMapper.createObjectNode();
            propertyNode.put("type", type);
            propertyNode.put("description", description);
            return propertyNode;
        }

        private ToolDefinitionBuilder add(String argName, ObjectNode propertyNode, boolean required) {
            propertiesNode.set(argName, propertyNode);
            if (required) {
                requiredArgs.add(argName);
            }
            return this;
        }
    }
}
