package io.github.yok.industrydb.types;

import java.sql.Types;

/**
 * Maps a backend's native column types to {@link ColumnType}.
 *
 * <p>
 * Implementations are total: a type they do not recognise maps to {@link ColumnType#UTF8} and is
 * read as text. Lookup goes by the native type name first, because JDBC type codes are reported
 * inconsistently across drivers (PostgreSQL reports {@code bool} as {@code BIT}, SQLite reports
 * whatever the declared type suggests), then falls back to the JDBC type code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TypeMapping {

    /**
     * Returns the columnar type for a result column.
     *
     * @param jdbcType type code from {@link java.sql.ResultSetMetaData#getColumnType(int)}
     * @param typeName native name from {@link java.sql.ResultSetMetaData#getColumnTypeName(int)},
     *        may be {@code null}
     * @return columnar type, never {@code null}
     */
    ColumnType map(int jdbcType, String typeName);

    /**
     * Returns the columnar type for a result column whose declared precision is known.
     *
     * <p>
     * The default ignores the precision. Mappings override it where the width decides the type.
     * </p>
     *
     * @param jdbcType type code
     * @param typeName native type name, may be {@code null}
     * @param precision value of {@link java.sql.ResultSetMetaData#getPrecision(int)}, {@code 0}
     *        or negative when the driver does not know it
     * @return columnar type, never {@code null}
     */
    default ColumnType map(int jdbcType, String typeName, int precision) {
        return map(jdbcType, typeName);
    }

    /**
     * Returns whether a column whose values do not all convert to its type is read as text.
     *
     * <p>
     * Backends with dynamic typing store values of any kind in any column; their mappings return
     * {@code true}. Such a column is retyped from its values: integers and reals widen to
     * {@link ColumnType#FLOAT64}, anything else that disagrees becomes {@link ColumnType#UTF8}.
     * Otherwise a value that does not convert raises {@code SERIALIZATION_FAILURE}.
     * </p>
     *
     * @return {@code true} to retype mixed columns instead of failing
     */
    default boolean readsMixedColumnsAsText() {
        return false;
    }

    /**
     * Returns whether the native type holds a UUID that must be read as canonical lower-case text.
     *
     * @param typeName native type name, may be {@code null}
     * @return {@code true} for UUID types
     */
    default boolean isUuid(String typeName) {
        return false;
    }

    /**
     * Returns whether the native type is a timestamp carrying a zone offset.
     *
     * <p>
     * Such values are read as {@link java.time.OffsetDateTime} and normalized to UTC.
     * </p>
     *
     * @param typeName native type name, may be {@code null}
     * @return {@code true} for zoned timestamp types
     */
    default boolean isZonedTimestamp(String typeName) {
        return false;
    }

    /**
     * Maps a JDBC type code alone, for types a backend mapping does not know by name.
     *
     * @param jdbcType type code
     * @return columnar type, {@link ColumnType#UTF8} for anything unrecognised
     */
    static ColumnType fromJdbcType(int jdbcType) {
        switch (jdbcType) {
            case Types.BIGINT:
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return ColumnType.INT64;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
            case Types.NUMERIC:
            case Types.DECIMAL:
                return ColumnType.FLOAT64;
            case Types.BOOLEAN:
            case Types.BIT:
                return ColumnType.BOOLEAN;
            case Types.DATE:
                return ColumnType.DATE;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return ColumnType.TIMESTAMP;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return ColumnType.BINARY;
            case Types.NULL:
                return ColumnType.NULL;
            default:
                return ColumnType.UTF8;
        }
    }
}
