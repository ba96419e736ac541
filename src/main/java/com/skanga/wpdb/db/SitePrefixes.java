package com.skanga.wpdb.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps WordPress multisite identifiers to physical table prefixes.
 * The main site uses the base prefix ({@code wp_}); sub-site N uses {@code wp_N_}.
 */
public final class SitePrefixes {
    public static final String DEFAULT_PREFIX = "wp_";

    private SitePrefixes() {
    }

    /**
     * Returns the table prefix for a site.
     * A null, zero, negative or {@code 1} site id all address the main site.
     *
     * @param basePrefix Base prefix of the installation, e.g. {@code wp_}
     * @param siteId Multisite blog id, may be null
     * @return {@code basePrefix} for the main site, {@code basePrefix + siteId + "_"} otherwise
     */
    public static String resolvePrefix(String basePrefix, Integer siteId) {
        if (siteId == null || siteId <= 1) {
            return basePrefix;
        }
        return basePrefix + siteId + "_";
    }

    /**
     * Qualifies a table name with the prefix unless it already carries it,
     * so callers may pass {@code wp_posts} or just {@code posts}.
     */
    public static String resolveTable(String prefix, String tableName) {
        if (tableName.startsWith(prefix)) {
            return tableName;
        }
        return prefix + tableName;
    }

    /**
     * Finds every site prefix present in a table listing.
     *
     * @param basePrefix Base prefix of the installation
     * @param tableNames Physical table names in the database
     * @return Sorted, duplicate-free prefixes, always including the base prefix
     */
    public static List<String> detectSitePrefixes(String basePrefix, Collection<String> tableNames) {
        SortedSet<String> prefixes = new TreeSet<>();
        prefixes.add(basePrefix);
        Pattern sitePattern = Pattern.compile("^" + Pattern.quote(basePrefix) + "(\\d+)_");
        for (String tableName : tableNames) {
            Matcher siteMatcher = sitePattern.matcher(tableName);
            if (siteMatcher.find()) {
                prefixes.add(basePrefix + siteMatcher.group(1) + "_");
            }
        }
        return new ArrayList<>(prefixes);
    }

    /**
     * Backtick-quotes an identifier for embedding in tool-built SQL.
     */
    public static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
