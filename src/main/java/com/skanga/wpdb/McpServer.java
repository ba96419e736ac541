package com.skanga.wpdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.wpdb.config.CliUtils;
import com.skanga.wpdb.config.ConfigParams;
import com.skanga.wpdb.config.ResourceManager;
import com.skanga.wpdb.db.ConnectionPoolManager;
import com.skanga.wpdb.db.DatabaseStartupException;
import com.skanga.wpdb.db.QueryExecutor;
import com.skanga.wpdb.tools.MetaTools;
import com.skanga.wpdb.tools.QueryTools;
import com.skanga.wpdb.tools.SchemaTools;
import com.skanga.wpdb.tools.TermTools;
import com.skanga.wpdb.tools.ToolOutput;
import com.skanga.wpdb.tools.ToolSupport;
import com.skanga.wpdb.tools.WordPressTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP server exposing read-only WordPress database tools over JSON-RPC 2.0 on stdio.
 *
 * <p>Every tool runs through the shared {@link QueryExecutor}, so the row cap, query timeout and
 * connection pool limits apply to all of them. Raw SQL from {@code wp_query} is checked by the
 * read-only validator before it reaches the database.
 */
public class McpServer {
    public static final String DEFAULT_PROTOCOL_VERSION = "2025-11-25";
    public static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            DEFAULT_PROTOCOL_VERSION,
            "2025-06-18"
    );
    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    final ConnectionPoolManager poolManager;
    private final QueryExecutor queryExecutor;
    private final QueryTools queryTools;
    private final SchemaTools schemaTools;
    private final TermTools termTools;
    private final MetaTools metaTools;
    private final Map<String, ObjectNode> toolDefinitions;

    // Lifecycle management
    private enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;

    /**
     * Creates a server for the given configuration. The pool is not opened until {@link #start()}.
     *
     * @param configParams Database and limit configuration
     */
    public McpServer(ConfigParams configParams) {
        this(new ConnectionPoolManager(configParams));
    }

    /**
     * Creates a server around an existing pool manager, typically one pointed at a test database.
     *
     * @param poolManager Pool manager, started or not
     */
    public McpServer(ConnectionPoolManager poolManager) {
        this(poolManager, new QueryExecutor(poolManager));
    }

    McpServer(ConnectionPoolManager poolManager, QueryExecutor queryExecutor) {
        this.poolManager = poolManager;
        this.queryExecutor = queryExecutor;
        this.queryTools = new QueryTools(poolManager, queryExecutor);
        this.schemaTools = new SchemaTools(poolManager, queryExecutor);
        this.termTools = new TermTools(poolManager, queryExecutor);
        this.metaTools = new MetaTools(poolManager, queryExecutor);
        this.toolDefinitions = collectDefinitions(List.of(queryTools, schemaTools, termTools, metaTools));
    }

    private static Map<String, ObjectNode> collectDefinitions(List<WordPressTools> toolGroups) {
        Map<String, ObjectNode> definitions = new LinkedHashMap<>();
        for (WordPressTools toolGroup : toolGroups) {
            for (ObjectNode definition : toolGroup.definitions()) {
                definitions.put(definition.path("name").asText(), definition);
            }
        }
        return definitions;
    }

    /**
     * Opens the connection pool and detects the table prefix.
     *
     * @throws DatabaseStartupException if the database cannot be reached
     */
    public void start() throws DatabaseStartupException {
        poolManager.start();
    }

    /**
     * Handles a single JSON-RPC request or notification.
     *
     * @param requestNode The parsed JSON-RPC request
     * @return JSON response node, or null for notifications (requests without id)
     */
    public JsonNode handleRequest(JsonNode requestNode) {
        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");

        boolean isNotification = !requestNode.has("id");
        JsonNode requestId = isNotification ? null : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            enforceLifecycleRules(requestMethod);
            JsonNode resultNode = executeMethod(requestMethod, requestParams);

            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            return handleRequestException(e, requestMethod, isNotification, requestId);
        }
    }

    /**
     * Enforces server lifecycle rules for method execution.
     *
     * @throws IllegalStateException if the method is not allowed in the current state
     */
    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.SHUTDOWN) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.shutdown"));
        }

        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals("initialize")) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.not.initialized"));
        }

        if (serverState == ServerState.INITIALIZING && !requestMethod.equals("initialize")
                && !requestMethod.equals("notifications/initialized") && !requestMethod.equals("ping")) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.initializing"));
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams) {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams);
            case "notifications/initialized" -> handleNotificationInitialized();
            case "tools/list" -> handleListTools();
            case "tools/call" -> handleCallTool(requestParams);
            case "ping" -> objectMapper.createObjectNode();
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod));
        };
    }

    private JsonNode handleRequestException(Exception theException, String requestMethod, boolean isNotification,
                                            JsonNode requestId) {
        if (isNotification) {
            logExceptionForNotification(theException, requestMethod);
            return null;
        }

        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse("invalid_request", theException.getMessage(), requestId);
        }

        if (theException instanceof IllegalArgumentException) {
            return handleIllegalArgumentException((IllegalArgumentException) theException, requestId);
        }

        logger.error("Unexpected error handling {}", requestMethod, theException);
        return createErrorResponse("internal_error",
                ResourceManager.getErrorMessage("execution.unexpected"), requestId);
    }

    /**
     * Maps an IllegalArgumentException to a JSON-RPC error code by its message.
     */
    private JsonNode handleIllegalArgumentException(IllegalArgumentException theException, JsonNode requestId) {
        String message = theException.getMessage() == null ? "" : theException.getMessage();

        if (message.startsWith("Method not found:")) {
            logger.warn("Method not found: {}", message);
            return createErrorResponse("method_not_found", message, requestId);
        }

        if (message.startsWith("Unsupported protocol version:")) {
            logger.warn("Protocol version mismatch: {}", message);
            return createErrorResponse("invalid_request", message, requestId);
        }

        logger.warn("Invalid request parameters: {}", message);
        return createErrorResponse("invalid_params", message, requestId);
    }

    private void logExceptionForNotification(Exception theException, String requestMethod) {
        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation in notification {}: {}", requestMethod, theException.getMessage());
        } else if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid notification {}: {}", requestMethod, theException.getMessage());
        } else {
            logger.error("Unexpected error in notification {}", requestMethod, theException);
        }
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        if (serverState != ServerState.UNINITIALIZED) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.already.initialized",
                    serverState));
        }

        String clientProtocolVersion = requestParams.path("protocolVersion").asText("unknown");
        String negotiatedProtocolVersion = negotiateProtocolVersion(clientProtocolVersion);

        serverState = ServerState.INITIALIZING;
        logger.info("Server initializing with protocol version {}", negotiatedProtocolVersion);

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", negotiatedProtocolVersion);
        resultNode.set("capabilities", createCapabilities());
        resultNode.set("serverInfo", createServerInfo());
        return resultNode;
    }

    private String negotiateProtocolVersion(String clientProtocolVersion) {
        if (SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)) {
            return clientProtocolVersion;
        }

        String supportedVersions = String.join(", ", SUPPORTED_PROTOCOL_VERSIONS);
        throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                "protocol.unsupported.version", clientProtocolVersion, supportedVersions));
    }

    private JsonNode handleNotificationInitialized() {
        if (serverState != ServerState.INITIALIZING) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.unexpected.initialized",
                    serverState));
        }

        serverState = ServerState.INITIALIZED;
        logger.info("Server initialized and ready for operation");
        return null;
    }

    private JsonNode handleListTools() {
        ArrayNode toolsNode = objectMapper.createArrayNode();
        toolDefinitions.values().forEach(toolsNode::add);

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", toolsNode);
        return resultNode;
    }

    /**
     * Dispatches {@code tools/call}. Argument errors propagate as invalid params; tool failures
     * come back as a normal result flagged with {@code isError}.
     */
    JsonNode handleCallTool(JsonNode paramsNode) {
        String toolName = paramsNode.path("name").asText();
        ObjectNode toolDefinition = toolDefinitions.get(toolName);
        if (toolDefinition == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("protocol.tool.unknown", toolName));
        }

        JsonNode argsNode = paramsNode.path("arguments");
        ToolSupport.rejectUnknownArguments(argsNode, toolDefinition);
        if (argsNode.isMissingNode() || argsNode.isNull()) {
            argsNode = objectMapper.createObjectNode();
        }

        logger.debug("Calling tool {}", toolName);
        ToolOutput toolOutput = switch (toolName) {
            case QueryTools.WP_QUERY -> queryTools.query(argsNode);
            case QueryTools.WP_SEARCH_POSTS -> queryTools.searchPosts(argsNode);
            case SchemaTools.WP_LIST_TABLES -> schemaTools.listTables(argsNode);
            case SchemaTools.WP_DESCRIBE_TABLE -> schemaTools.describeTable(argsNode);
            case SchemaTools.WP_GET_SCHEMA -> schemaTools.getSchema(argsNode);
            case SchemaTools.WP_GET_RELATIONSHIPS -> schemaTools.getRelationships(argsNode);
            case TermTools.WP_GET_POST_TERMS -> termTools.getPostTerms(argsNode);
            case TermTools.WP_GET_TERM_POSTS -> termTools.getTermPosts(argsNode);
            case TermTools.WP_LIST_TAXONOMIES -> termTools.listTaxonomies(argsNode);
            case MetaTools.WP_GET_POST_META -> metaTools.getPostMeta(argsNode);
            case MetaTools.WP_GET_USER_META -> metaTools.getUserMeta(argsNode);
            case MetaTools.WP_GET_COMMENT_META -> metaTools.getCommentMeta(argsNode);
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("protocol.tool.unknown", toolName));
        };
        return toolResult(toolOutput);
    }

    private static ObjectNode toolResult(ToolOutput toolOutput) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        ArrayNode contentNode = responseNode.putArray("content");

        ObjectNode textContent = objectMapper.createObjectNode();
        textContent.put("type", "text");
        textContent.put("text", toolOutput.text());
        contentNode.add(textContent);

        // Tool errors are successful responses with error content
        responseNode.put("isError", toolOutput.isError());
        return responseNode;
    }

    /**
     * Starts the server in stdio mode. Reads one JSON-RPC message per line from stdin and writes
     * responses to stdout until stdin is closed.
     *
     * @throws IOException if stdin cannot be read
     */
    public void startStdioMode() throws IOException {
        serve(System.in, System.out);
    }

    void serve(InputStream inputStream, OutputStream outputStream) throws IOException {
        logger.info("Starting WordPress DB MCP Server in stdio mode...");

        BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        PrintWriter printWriter = new PrintWriter(outputStream, true, StandardCharsets.UTF_8);

        String currLine;
        while ((currLine = bufferedReader.readLine()) != null) {
            if (!currLine.isBlank()) {
                processStdioRequest(currLine, printWriter);
            }
        }
        printWriter.flush();

        logger.info("WordPress DB MCP Server stopped.");
    }

    private void processStdioRequest(String requestLine, PrintWriter printWriter) {
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable request: {}", e.getOriginalMessage());
            writeResponse(printWriter, createErrorResponse("parse_error",
                    ResourceManager.getErrorMessage("protocol.parse.error"), null));
            return;
        }

        if (!requestNode.isObject()) {
            writeResponse(printWriter, createErrorResponse("invalid_request",
                    ResourceManager.getErrorMessage("protocol.invalid.message"), null));
            return;
        }

        JsonNode responseNode = handleRequest(requestNode);
        if (responseNode != null) {
            writeResponse(printWriter, responseNode);
        }
    }

    private static void writeResponse(PrintWriter printWriter, JsonNode responseNode) {
        try {
            printWriter.println(objectMapper.writeValueAsString(responseNode));
            printWriter.flush();
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize response", e);
        }
    }

    private static ObjectNode createCapabilities() {
        ObjectNode capabilitiesNode = objectMapper.createObjectNode();
        ObjectNode toolsNode = capabilitiesNode.putObject("tools");
        toolsNode.put("listChanged", false);
        return capabilitiesNode;
    }

    private ObjectNode createServerInfo() {
        ConfigParams configParams = poolManager.configParams();
        ObjectNode infoNode = objectMapper.createObjectNode();
        infoNode.put("name", CliUtils.SERVER_NAME);
        infoNode.put("version", CliUtils.SERVER_VERSION);
        infoNode.put("description", CliUtils.SERVER_DESCRIPTION);

        ObjectNode limitsNode = infoNode.putObject("limits");
        limitsNode.put("maxRows", configParams.maxRows());
        limitsNode.put("queryTimeoutSeconds", configParams.queryTimeoutSeconds());
        limitsNode.put("maxConnections", configParams.poolMaxSize());
        limitsNode.put("readOnly", true);
        return infoNode;
    }

    private static JsonNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        setRespId(requestId, responseNode);
        responseNode.set("result", resultNode == null ? objectMapper.createObjectNode() : resultNode);
        return responseNode;
    }

    /**
     * Creates a JSON-RPC error response.
     *
     * @param code Error code string, mapped to the numeric JSON-RPC code
     * @param message Error message
     * @param requestId The request id, null when it could not be determined
     * @return JSON-RPC error response
     */
    static JsonNode createErrorResponse(String code, String message, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        setRespId(requestId, responseNode);

        ObjectNode errorNode = responseNode.putObject("error");
        errorNode.put("code", getErrorCode(code));
        errorNode.put("message", message);
        return responseNode;
    }

    /**
     * Echoes the request id exactly, whatever its JSON type.
     */
    private static void setRespId(JsonNode requestId, ObjectNode responseNode) {
        if (requestId == null) {
            responseNode.putNull("id");
        } else {
            responseNode.set("id", requestId);
        }
    }

    static int getErrorCode(String codeString) {
        return switch (codeString) {
            case "parse_error" -> -32700;
            case "invalid_request" -> -32600;
            case "method_not_found" -> -32601;
            case "invalid_params" -> -32602;
            default -> -32603;
        };
    }

    String getServerState() {
        return serverState.toString();
    }

    /**
     * Shuts down the server, stopping the query workers and closing the pool.
     * Safe to call more than once.
     */
    public synchronized void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }

        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;

        try {
            queryExecutor.close();
        } finally {
            poolManager.shutdown();
        }

        logger.info("MCP server shutdown complete");
    }

    /**
     * Entry point. Exit codes: 0 after help or version, 1 when the database cannot be reached,
     * 2 for configuration errors, 3 for anything unexpected.
     *
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }

        try {
            ConfigParams configParams;
            try {
                configParams = CliUtils.loadConfiguration(args);
            } catch (IOException | IllegalArgumentException e) {
                logger.error("Configuration error: {}", e.getMessage());
                logger.error("\n{}", ResourceManager.getErrorMessage("startup.config.error.format"));
                System.exit(2);
                return;
            }

            McpServer mcpServer = new McpServer(configParams);
            try {
                mcpServer.start();
            } catch (DatabaseStartupException e) {
                logger.error("\n{}", ResourceManager.getErrorMessage("startup.database.error",
                        configParams.describeTransport(), e.getMessage()));
                mcpServer.shutdown();
                System.exit(1);
                return;
            }

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down WordPress DB MCP Server...");
                mcpServer.shutdown();
            }));

            mcpServer.startStdioMode();
            mcpServer.shutdown();
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()));
            System.exit(3);
        }
    }
}
