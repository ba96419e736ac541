package com.skanga.wpdb.config;

import com.skanga.wpdb.McpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for handling command line interface operations.
 * Provides argument parsing, configuration loading, help display and version information.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "wpdb-mcp";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "Read-only MCP server for WordPress databases";

    static final String ENV_PREFIX = "WP_";
    static final String SYSPROP_PREFIX = "wp.";

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("h", "help");
        shortToLong.put("v", "version");
        shortToLong.put("c", "config_file");

        // Database connection
        shortToLong.put("H", "db_host");
        shortToLong.put("p", "db_port");
        shortToLong.put("S", "db_socket");
        shortToLong.put("u", "db_user");
        shortToLong.put("P", "db_password");
        shortToLong.put("d", "db_name");
        shortToLong.put("x", "table_prefix");

        // Pool and query limits
        shortToLong.put("r", "max_rows");
        shortToLong.put("q", "query_timeout");
        shortToLong.put("n", "pool_min_size");
        shortToLong.put("N", "pool_max_size");
        shortToLong.put("t", "connect_timeout");
        shortToLong.put("M", "max_sql_length");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-u) and long form (--db_user) arguments,
     * in key=value and key value formats. Keys are upper-cased for lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey;
            String argValue;
            String argBody;
            boolean shortForm;

            if (currArg.startsWith("--")) {
                argBody = currArg.substring(2);
                shortForm = false;
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                argBody = currArg.substring(1);
                shortForm = true;
            } else {
                logger.debug("Ignoring positional argument: {}", currArg);
                continue;
            }

            if (argBody.contains("=")) {
                String[] argParts = argBody.split("=", 2);
                argKey = argParts[0];
                argValue = argParts[1];
            } else {
                argKey = argBody;
                // Next argument is a value unless it looks like another option
                if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    argValue = args[i + 1];
                    i++;
                } else {
                    argValue = "true";
                }
            }

            if (shortForm) {
                argKey = shortToLong.get(argKey);
            }
            if (argKey == null || argKey.isEmpty()) {
                logger.warn("Ignoring unknown argument: {}", currArg);
                continue;
            }
            argsMap.put(argKey.toUpperCase(), argValue);
        }

        return argsMap;
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println("Usage: java -jar wpdb-mcp-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("Every option can also be set as an environment variable (WP_DB_HOST)");
        System.out.println("or a system property (-Dwp.db.host=...). Command line wins, then the");
        System.out.println("config file, then environment, then system properties.");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                       Show this help message and exit");
        System.out.println("  -v, --version                    Show version information and exit");
        System.out.println("  -c, --config_file=<path>         Load KEY=VALUE configuration from file");
        System.out.println();
        System.out.println("DATABASE CONNECTION:");
        System.out.println("  -H, --db_host=<host>             TCP host (default: " + ConfigParams.DEFAULT_HOST + ")");
        System.out.println("  -p, --db_port=<port>             TCP port (default: " + ConfigParams.DEFAULT_PORT + ")");
        System.out.println("  -S, --db_socket=<path>           Unix socket path, replaces host and port when set");
        System.out.println("  -u, --db_user=<user>             Database user (default: " + ConfigParams.DEFAULT_USER + ")");
        System.out.println("  -P, --db_password=<password>     Database password (default: empty)");
        System.out.println("  -d, --db_name=<name>             Database name (default: " + ConfigParams.DEFAULT_DB_NAME + ")");
        System.out.println("  -x, --table_prefix=<prefix>      Base table prefix (default: auto-detect)");
        System.out.println();
        System.out.println("LIMITS:");
        System.out.println("  -r, --max_rows=<num>             Max rows per query (default: " + ConfigParams.DEFAULT_MAX_ROWS + ")");
        System.out.println("  -q, --query_timeout=<sec>        Query timeout (default: " + ConfigParams.DEFAULT_QUERY_TIMEOUT_SECONDS + ")");
        System.out.println("  -n, --pool_min_size=<num>        Minimum idle connections (default: " + ConfigParams.DEFAULT_POOL_MIN_SIZE + ")");
        System.out.println("  -N, --pool_max_size=<num>        Maximum connections (default: " + ConfigParams.DEFAULT_POOL_MAX_SIZE + ")");
        System.out.println("  -t, --connect_timeout=<sec>      Connect timeout (default: " + ConfigParams.DEFAULT_CONNECT_TIMEOUT_SECONDS + ")");
        System.out.println("  -M, --max_sql_length=<chars>     Max raw SQL length (default: " + ConfigParams.DEFAULT_MAX_SQL_LENGTH + ")");
        System.out.println();
        System.out.println("EXAMPLES:");
        System.out.println("  java -jar wpdb-mcp-" + SERVER_VERSION + ".jar -H db.local -u wp -P secret -d wordpress");
        System.out.println("  java -jar wpdb-mcp-" + SERVER_VERSION + ".jar --db_socket /var/run/mysqld/mysqld.sock --db_user=wp");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + McpServer.DEFAULT_PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables and system properties.
     * Priority order: CLI args (--db_host) > config file (DB_HOST=) > environment (WP_DB_HOST) >
     * system properties (-Dwp.db.host=) > defaults.
     *
     * @param args Command line arguments
     * @return Validated ConfigParams instance
     * @throws IOException if the config file cannot be read
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException(ResourceManager.getErrorMessage("config.file.load.failed", configFile), e);
            }
        }

        String dbHost = getConfigValue("DB_HOST", ConfigParams.DEFAULT_HOST, cliArgs, fileConfig);
        String dbPort = getConfigValue("DB_PORT", String.valueOf(ConfigParams.DEFAULT_PORT), cliArgs, fileConfig);
        String dbSocket = getConfigValue("DB_SOCKET", "", cliArgs, fileConfig);
        String dbUser = getConfigValue("DB_USER", ConfigParams.DEFAULT_USER, cliArgs, fileConfig);
        String dbPassword = getConfigValue("DB_PASSWORD", "", cliArgs, fileConfig);
        String dbName = getConfigValue("DB_NAME", ConfigParams.DEFAULT_DB_NAME, cliArgs, fileConfig);
        String tablePrefix = getConfigValue("TABLE_PREFIX", "", cliArgs, fileConfig);
        String maxRows = getConfigValue("MAX_ROWS", String.valueOf(ConfigParams.DEFAULT_MAX_ROWS), cliArgs, fileConfig);
        String queryTimeout = getConfigValue("QUERY_TIMEOUT",
                String.valueOf(ConfigParams.DEFAULT_QUERY_TIMEOUT_SECONDS), cliArgs, fileConfig);
        String poolMinSize = getConfigValue("POOL_MIN_SIZE",
                String.valueOf(ConfigParams.DEFAULT_POOL_MIN_SIZE), cliArgs, fileConfig);
        String poolMaxSize = getConfigValue("POOL_MAX_SIZE",
                String.valueOf(ConfigParams.DEFAULT_POOL_MAX_SIZE), cliArgs, fileConfig);
        String connectTimeout = getConfigValue("CONNECT_TIMEOUT",
                String.valueOf(ConfigParams.DEFAULT_CONNECT_TIMEOUT_SECONDS), cliArgs, fileConfig);
        String maxSqlLength = getConfigValue("MAX_SQL_LENGTH",
                String.valueOf(ConfigParams.DEFAULT_MAX_SQL_LENGTH), cliArgs, fileConfig);

        if (dbPassword.isEmpty()) {
            logger.warn("DB_PASSWORD is empty; connecting without a password");
        }

        try {
            return new ConfigParams(dbHost, parseIntegerConfig("DB_PORT", dbPort), dbSocket, dbUser, dbPassword,
                    dbName, tablePrefix,
                    parseIntegerConfig("MAX_ROWS", maxRows),
                    parseIntegerConfig("QUERY_TIMEOUT", queryTimeout),
                    parseIntegerConfig("POOL_MIN_SIZE", poolMinSize),
                    parseIntegerConfig("POOL_MAX_SIZE", poolMaxSize),
                    parseIntegerConfig("CONNECT_TIMEOUT", connectTimeout),
                    parseIntegerConfig("MAX_SQL_LENGTH", maxSqlLength));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.validation.failed", e.getMessage()), e);
        }
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     *
     * @param varName Config parameter name (uppercase)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs Parsed command line arguments
     * @param fileConfig Configuration from file, null when no file was given
     * @return The configuration value from the highest priority source
     */
    static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs,
                                 Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName);
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName);
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(ENV_PREFIX + varName);
        if (envValue != null) {
            return envValue;
        }

        // DB_HOST -> wp.db.host
        String propValue = System.getProperty(SYSPROP_PREFIX + varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are comments, empty lines are ignored.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of uppercase configuration keys to values
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = Files.newBufferedReader(Path.of(configFilePath), StandardCharsets.UTF_8)) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if (paramValue.length() >= 2 && ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                        || (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    private static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }
}
