package me.christianrobert.mspgsync.transfer.service;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.tools.TypeCategory;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Converts SQL Server values to their PostgreSQL COPY (CSV) text form.
 *
 * Reading picks the JDBC accessor from the category of the target type; formatting turns the
 * Java value into text PostgreSQL parses back into the same value. {@code null} stays null
 * and becomes the COPY null marker.
 */
public final class ColumnValueConverter {

    private static final HexFormat HEX = HexFormat.of();

    private ColumnValueConverter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Reads one column of the current row.
     */
    public static Object read(ResultSet rs, int index, ColumnMapping column) throws SQLException {
        TypeCategory category = TypeCategory.classify(column.getTargetType());
        switch (category) {
            case BOOLEAN: {
                boolean value = rs.getBoolean(index);
                return rs.wasNull() ? null : value;
            }
            case BINARY:
                return rs.getBytes(index);
            case DECIMAL:
                return rs.getBigDecimal(index);
            case DATETIME:
                if ("datetimeoffset".equalsIgnoreCase(column.getSourceColumn().getDataType())) {
                    return rs.getObject(index, OffsetDateTime.class);
                }
                return rs.getObject(index, LocalDateTime.class);
            default:
                return rs.getString(index);
        }
    }

    /**
     * Text form of a value as expected by COPY in CSV format.
     */
    public static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return stripNullBytes((String) value);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof byte[]) {
            return "\\x" + HEX.formatHex((byte[]) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return stripNullBytes(value.toString());
    }

    /**
     * PostgreSQL text cannot hold 0x00.
     */
    static String stripNullBytes(String value) {
        if (value.indexOf('\0') == -1) {
            return value;
        }
        return value.replace("\0", "");
    }
}
