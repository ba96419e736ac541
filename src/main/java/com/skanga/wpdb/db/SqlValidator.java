package com.skanga.wpdb.db;

import com.skanga.wpdb.config.ResourceManager;
import com.skanga.wpdb.db.ValidationOutcome.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical read-only policy for caller-supplied SQL.
 * <p>
 * This is not a parser. Comments are stripped first, then the remaining text is checked in order for
 * statement chaining, the leading verb, write/DDL keywords and system schema references. Keywords inside
 * quoted string literals are not exempt, so {@code SELECT 'drop'} is rejected.
 * <p>
 * The stripped text is only used for checking; the statement that gets executed is always the original.
 */
public final class SqlValidator {
    private static final Logger logger = LoggerFactory.getLogger(SqlValidator.class);

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("--.*?$", Pattern.MULTILINE);
    private static final Pattern HASH_COMMENT = Pattern.compile("#.*?$", Pattern.MULTILINE);

    private static final Pattern ALLOWED_VERB =
            Pattern.compile("^(SELECT|SHOW|DESCRIBE|EXPLAIN)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISALLOWED_KEYWORD = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|DROP|ALTER|CREATE|TRUNCATE|REPLACE|GRANT|REVOKE|LOAD"
                    + "|INTO\\s+OUTFILE|INTO\\s+DUMPFILE)\\b",
            Pattern.CASE_INSENSITIVE);

    static final List<String> SYSTEM_SCHEMAS = List.of("information_schema", "mysql", "performance_schema", "sys");
    private static final List<SchemaPatterns> SYSTEM_SCHEMA_PATTERNS = SYSTEM_SCHEMAS.stream()
            .map(SchemaPatterns::forSchema)
            .toList();

    private static final int LOG_SQL_LIMIT = 200;

    private SqlValidator() {
    }

    /**
     * Checks a SQL string against the read-only policy.
     *
     * @param sql Caller-supplied SQL, may be null
     * @return Approval, or a rejection naming the rule that fired
     */
    public static ValidationOutcome validate(String sql) {
        String cleanSql = stripComments(sql == null ? "" : sql);

        // Step 1: one statement, tolerating a single trailing terminator
        String trimmed = cleanSql.stripTrailing();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
        }
        if (trimmed.indexOf(';') >= 0) {
            return reject(RejectionReason.MULTIPLE_STATEMENTS, sql,
                    ResourceManager.getErrorMessage("validation.multiple.statements"));
        }

        // Step 2: leading verb, allowing one opening parenthesis
        String leading = cleanSql.strip();
        if (leading.startsWith("(")) {
            leading = leading.substring(1);
        }
        if (!ALLOWED_VERB.matcher(leading).find()) {
            return reject(RejectionReason.DISALLOWED_VERB, sql,
                    ResourceManager.getErrorMessage("validation.disallowed.verb"));
        }

        // Step 3: write and DDL keywords anywhere outside comments
        Matcher keywordMatcher = DISALLOWED_KEYWORD.matcher(cleanSql);
        if (keywordMatcher.find()) {
            return reject(RejectionReason.DISALLOWED_KEYWORD, sql,
                    ResourceManager.getErrorMessage("validation.disallowed.keyword",
                            keywordMatcher.group(1).replaceAll("\\s+", " ").toUpperCase()));
        }

        // Step 4: system schemas
        for (SchemaPatterns schemaPatterns : SYSTEM_SCHEMA_PATTERNS) {
            if (schemaPatterns.matches(cleanSql)) {
                return reject(RejectionReason.SYSTEM_SCHEMA_ACCESS, sql,
                        ResourceManager.getErrorMessage("validation.system.schema", schemaPatterns.schema()));
            }
        }

        return ValidationOutcome.accept();
    }

    /**
     * Replaces block, double-dash and hash comments with a single space each.
     */
    static String stripComments(String sql) {
        String cleanSql = BLOCK_COMMENT.matcher(sql).replaceAll(" ");
        cleanSql = LINE_COMMENT.matcher(cleanSql).replaceAll(" ");
        return HASH_COMMENT.matcher(cleanSql).replaceAll(" ");
    }

    private static ValidationOutcome reject(RejectionReason reason, String sql, String message) {
        logger.warn("SQL rejected ({}): {}", reason.code(), abbreviate(sql));
        return ValidationOutcome.rejected(reason, message);
    }

    public static String abbreviate(String sql) {
        if (sql == null) {
            return "";
        }
        String singleLine = sql.replaceAll("\\s+", " ").trim();
        return singleLine.length() > LOG_SQL_LIMIT ? singleLine.substring(0, LOG_SQL_LIMIT) + "..." : singleLine;
    }

    /**
     * The three reference forms of a system schema: {@code schema.}, {@code `schema`.} and {@code schema`}.
     */
    private record SchemaPatterns(String schema, List<Pattern> patterns) {
        static SchemaPatterns forSchema(String schema) {
            String quoted = Pattern.quote(schema);
            return new SchemaPatterns(schema, List.of(
                    Pattern.compile("\\b" + quoted + "\\s*\\.", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("`" + quoted + "`\\s*\\.", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\b" + quoted + "\\s*`", Pattern.CASE_INSENSITIVE)));
        }

        boolean matches(String sql) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(sql).find()) {
                    return true;
                }
            }
            return false;
        }
    }
}
