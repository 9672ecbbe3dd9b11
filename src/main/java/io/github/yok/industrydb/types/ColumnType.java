package io.github.yok.industrydb.types;

import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Value type of one {@link Column}.
 *
 * <p>
 * Each type fixes the Java class of the non-null values a column may hold and the JDBC type used
 * when a null of that column is bound as a parameter.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ColumnType {

    INT64(Long.class, Types.BIGINT),

    FLOAT64(Double.class, Types.DOUBLE),

    UTF8(String.class, Types.VARCHAR),

    BOOLEAN(Boolean.class, Types.BOOLEAN),

    DATE(LocalDate.class, Types.DATE),

    TIMESTAMP(LocalDateTime.class, Types.TIMESTAMP),

    BINARY(byte[].class, Types.VARBINARY),

    // Column whose every value is null
    NULL(Void.class, Types.NULL);

    private final Class<?> javaType;

    private final int jdbcType;

    /**
     * Returns whether a value may be stored in a column of this type.
     *
     * @param value value, may be {@code null}
     * @return {@code true} if the value is null or an instance of {@link #getJavaType()}
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        if (this == NULL) {
            return false;
        }
        return javaType.isInstance(value);
    }
}
