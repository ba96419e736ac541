package com.skanga.wpdb.db;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JDBC values into the small JSON-safe set that leaves the executor:
 * text, integers, floating point, booleans, ISO-8601 strings and null.
 */
public final class RowValues {
    private RowValues() {
    }

    /**
     * Column labels of a result set, in select order.
     */
    public static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
        int columnCount = metaData.getColumnCount();
        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            labels.add(metaData.getColumnLabel(i));
        }
        return labels;
    }

    /**
     * Reads the current row. Duplicate labels keep the last value, as a map can hold only one.
     */
    public static Map<String, Object> readRow(ResultSet resultSet, List<String> columnLabels) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columnLabels.size(); i++) {
            row.put(columnLabels.get(i), toJsonSafe(resultSet.getObject(i + 1)));
        }
        return Collections.unmodifiableMap(row);
    }

    public static Object toJsonSafe(Object value) throws SQLException {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof byte[]) {
            return decodeBytes((byte[]) value);
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime().format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        if (value instanceof TemporalAccessor) {
            return formatTemporal((TemporalAccessor) value);
        }
        if (value instanceof java.util.Date) {
            Timestamp timestamp = new Timestamp(((java.util.Date) value).getTime());
            return timestamp.toLocalDateTime().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            return decodeBytes(blob.getBytes(1, (int) blob.length()));
        }
        return value.toString();
    }

    /**
     * Decodes strict UTF-8, or describes the value as {@code <binary N bytes>} when it is not text.
     */
    static String decodeBytes(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return "<binary " + bytes.length + " bytes>";
        }
    }

    private static String formatTemporal(TemporalAccessor temporal) {
        if (temporal instanceof LocalDateTime) {
            return ((LocalDateTime) temporal).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (temporal instanceof LocalDate) {
            return ((LocalDate) temporal).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (temporal instanceof LocalTime) {
            return ((LocalTime) temporal).format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        if (temporal instanceof OffsetDateTime) {
            return ((OffsetDateTime) temporal).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (temporal instanceof ZonedDateTime) {
            return ((ZonedDateTime) temporal).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return temporal.toString();
    }
}
