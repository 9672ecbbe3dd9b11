package io.github.yok.industrydb.types;

import io.github.yok.industrydb.error.ErrorKind;
import io.github.yok.industrydb.error.IndustryDbException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Drains a JDBC {@link ResultSet} into a {@link ColumnarBatch}.
 *
 * <p>
 * Column types come from the backend's {@link TypeMapping}. Columns the mapping reports as
 * {@link ColumnType#NULL} (SQLite expressions without a declared type) are typed after reading,
 * from their non-null values; a column holding only nulls stays {@code NULL}.
 * </p>
 *
 * <p>
 * A value that cannot be converted to its column type raises
 * {@link ErrorKind#SERIALIZATION_FAILURE}, unless the mapping
 * {@linkplain TypeMapping#readsMixedColumnsAsText() reads mixed columns as text}; the whole column
 * is then typed from its values like an untyped one, which makes it {@link ColumnType#UTF8} when
 * the values disagree. {@link SQLException}s are left to the caller, which
 * translates them with its backend's rules.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ColumnarResultReader {

    private static final Set<String> TRUE_TEXT = Set.of("true", "t", "1", "yes", "y", "on");
    private static final Set<String> FALSE_TEXT = Set.of("false", "f", "0", "no", "n", "off");

    private final TypeMapping mapping;

    /**
     * Reads every remaining row of the result set.
     *
     * @param resultSet open result set, positioned before the first row
     * @return batch holding all rows; column names and types are kept when there are no rows
     * @throws SQLException if the driver fails while reading
     * @throws IndustryDbException with {@code SERIALIZATION_FAILURE} if a value cannot be
     *         converted and the mapping keeps columns strictly typed, or {@code QUERY_FAILURE}
     *         if two result columns share a label
     */
    public ColumnarBatch read(ResultSet resultSet) throws SQLException, IndustryDbException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int count = metaData.getColumnCount();
        String[] names = new String[count];
        String[] typeNames = new String[count];
        ColumnType[] types = new ColumnType[count];
        List<List<Object>> values = new ArrayList<>(count);
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < count; i++) {
            String label = metaData.getColumnLabel(i + 1);
            if (StringUtils.isEmpty(label)) {
                label = metaData.getColumnName(i + 1);
            }
            if (!seen.add(label)) {
                throw new IndustryDbException(ErrorKind.QUERY_FAILURE,
                        "Duplicate column label '" + label + "' in result; alias the columns");
            }
            names[i] = label;
            typeNames[i] = metaData.getColumnTypeName(i + 1);
            types[i] = mapping.map(metaData.getColumnType(i + 1), typeNames[i],
                    metaData.getPrecision(i + 1));
            values.add(new ArrayList<>());
        }

        while (resultSet.next()) {
            for (int i = 0; i < count; i++) {
                values.get(i).add(readValue(resultSet, i + 1, types[i], typeNames[i]));
            }
        }

        List<Column> columns = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            List<Object> columnValues = values.get(i);
            ColumnType type = types[i];
            if (type == ColumnType.NULL) {
                type = inferType(columnValues);
            }
            if (types[i] == ColumnType.NULL || isReadRaw(type)) {
                try {
                    columnValues = convertAll(columnValues, type, names[i]);
                } catch (IndustryDbException e) {
                    if (!mapping.readsMixedColumnsAsText()) {
                        throw e;
                    }
                    ColumnType widened = inferType(columnValues);
                    log.debug("Column '{}' holds values other than {}; reading it as {}",
                            names[i], type, widened);
                    type = widened;
                    columnValues = convertAll(columnValues, type, names[i]);
                }
            }
            columns.add(new Column(names[i], type, columnValues));
        }
        return ColumnarBatch.of(columns);
    }

    /**
     * Returns whether values of the type are read with {@code getObject} and converted once all
     * rows are in.
     */
    private static boolean isReadRaw(ColumnType type) {
        return type != ColumnType.UTF8 && type != ColumnType.BINARY;
    }

    private Object readValue(ResultSet resultSet, int index, ColumnType type, String typeName)
            throws SQLException {
        if (type == ColumnType.TIMESTAMP && mapping.isZonedTimestamp(typeName)) {
            OffsetDateTime value = resultSet.getObject(index, OffsetDateTime.class);
            return value == null ? null
                    : value.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (type == ColumnType.UTF8) {
            String value = resultSet.getString(index);
            if (value != null && mapping.isUuid(typeName)) {
                return value.toLowerCase(Locale.ROOT);
            }
            return value;
        }
        if (type == ColumnType.BINARY) {
            return resultSet.getBytes(index);
        }
        // converted after all rows are read
        return resultSet.getObject(index);
    }

    /**
     * Types an untyped column from its values: integers, then any numbers, then booleans or
     * binary when every value agrees, and text for anything else.
     */
    private static ColumnType inferType(List<Object> rawValues) {
        ColumnType inferred = ColumnType.NULL;
        for (Object raw : rawValues) {
            if (raw == null) {
                continue;
            }
            ColumnType type = typeOf(raw);
            if (inferred == ColumnType.NULL || inferred == type) {
                inferred = type;
            } else if (isNumeric(inferred) && isNumeric(type)) {
                inferred = ColumnType.FLOAT64;
            } else {
                return ColumnType.UTF8;
            }
        }
        return inferred;
    }

    private static ColumnType typeOf(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short
                || raw instanceof Byte) {
            return ColumnType.INT64;
        }
        if (raw instanceof Number) {
            return ColumnType.FLOAT64;
        }
        if (raw instanceof Boolean) {
            return ColumnType.BOOLEAN;
        }
        if (raw instanceof byte[]) {
            return ColumnType.BINARY;
        }
        return ColumnType.UTF8;
    }

    private static boolean isNumeric(ColumnType type) {
        return type == ColumnType.INT64 || type == ColumnType.FLOAT64;
    }

    private static List<Object> convertAll(List<Object> rawValues, ColumnType type, String name)
            throws IndustryDbException {
        List<Object> converted = new ArrayList<>(rawValues.size());
        for (Object raw : rawValues) {
            converted.add(convert(raw, type, name));
        }
        return converted;
    }

    /**
     * Converts a raw driver value to the Java class of a column type.
     *
     * @param raw value returned by the driver, may be {@code null}
     * @param type target type
     * @param name column name used in error messages
     * @return converted value
     * @throws IndustryDbException with {@code SERIALIZATION_FAILURE} if conversion is impossible
     */
    static Object convert(Object raw, ColumnType type, String name) throws IndustryDbException {
        if (raw == null || type == ColumnType.NULL) {
            return null;
        }
        try {
            switch (type) {
                case INT64:
                    return toLong(raw);
                case FLOAT64:
                    return toDouble(raw);
                case BOOLEAN:
                    return toBoolean(raw);
                case DATE:
                    return toDate(raw);
                case TIMESTAMP:
                    return toTimestamp(raw);
                case BINARY:
                    return raw instanceof byte[] ? raw
                            : raw.toString().getBytes(StandardCharsets.UTF_8);
                default:
                    return raw instanceof byte[] ? new String((byte[]) raw, StandardCharsets.UTF_8)
                            : raw.toString();
            }
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            throw new IndustryDbException(ErrorKind.SERIALIZATION_FAILURE, "Column '" + name
                    + "': cannot read '" + raw + "' as " + type, e);
        }
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long) {
            return (Long) raw;
        }
        if (raw instanceof BigDecimal) {
            return ((BigDecimal) raw).longValueExact();
        }
        if (raw instanceof Double || raw instanceof Float) {
            return BigDecimal.valueOf(((Number) raw).doubleValue()).longValueExact();
        }
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? 1L : 0L;
        }
        return Long.valueOf(raw.toString().trim());
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        return Double.valueOf(raw.toString().trim());
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue() != 0;
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_TEXT.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_TEXT.contains(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + raw);
    }

    private static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate();
        }
        if (raw instanceof Timestamp || raw instanceof LocalDateTime || raw instanceof Number) {
            return toTimestamp(raw).toLocalDate();
        }
        return TemporalParsers.parseDate(raw.toString());
    }

    private static LocalDateTime toTimestamp(Object raw) {
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate().atStartOfDay();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (raw instanceof Number) {
            // epoch milliseconds
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) raw).longValue()),
                    ZoneOffset.UTC);
        }
        return TemporalParsers.parseTimestamp(raw.toString());
    }
}
