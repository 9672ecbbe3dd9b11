package io.github.yok.industrydb.connector.postgres;

import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.TypeMapping;
import java.util.Locale;
import java.util.Set;

/**
 * PostgreSQL native type mapping.
 *
 * <p>
 * {@code numeric} and {@code money} become {@link ColumnType#FLOAT64}; digits beyond double
 * precision are lost. {@code timestamptz} is normalized to UTC. Only a single {@code bit} is a
 * boolean; wider bit strings are read as text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresTypeMapping implements TypeMapping {

    static final PostgresTypeMapping INSTANCE = new PostgresTypeMapping();

    private static final Set<String> INTEGER_TYPE_NAMES = Set.of("int2", "int4", "int8",
            "smallint", "integer", "bigint", "smallserial", "serial", "bigserial", "oid");
    private static final Set<String> FLOATING_TYPE_NAMES = Set.of("float4", "float8", "real",
            "double precision", "numeric", "decimal", "money");
    private static final Set<String> BOOLEAN_TYPE_NAMES = Set.of("bool", "boolean", "bit");
    private static final Set<String> TEXT_TYPE_NAMES = Set.of("text", "varchar", "bpchar", "char",
            "name", "citext", "json", "jsonb", "xml", "character varying", "character");
    private static final Set<String> TIMESTAMP_TYPE_NAMES =
            Set.of("timestamp", "timestamp without time zone");
    private static final Set<String> ZONED_TIMESTAMP_TYPE_NAMES =
            Set.of("timestamptz", "timestamp with time zone");

    @Override
    public ColumnType map(int jdbcType, String typeName) {
        String name = normalize(typeName);
        if (INTEGER_TYPE_NAMES.contains(name)) {
            return ColumnType.INT64;
        }
        if (FLOATING_TYPE_NAMES.contains(name)) {
            return ColumnType.FLOAT64;
        }
        if (BOOLEAN_TYPE_NAMES.contains(name)) {
            return ColumnType.BOOLEAN;
        }
        if (TEXT_TYPE_NAMES.contains(name) || isUuid(name)) {
            return ColumnType.UTF8;
        }
        if ("date".equals(name)) {
            return ColumnType.DATE;
        }
        if (TIMESTAMP_TYPE_NAMES.contains(name) || ZONED_TIMESTAMP_TYPE_NAMES.contains(name)) {
            return ColumnType.TIMESTAMP;
        }
        if ("bytea".equals(name)) {
            return ColumnType.BINARY;
        }
        if (!name.isEmpty()) {
            // arrays, ranges, enums, geometric types, time, interval ...
            return ColumnType.UTF8;
        }
        return TypeMapping.fromJdbcType(jdbcType);
    }

    @Override
    public ColumnType map(int jdbcType, String typeName, int precision) {
        if ("bit".equals(normalize(typeName)) && precision > 1) {
            return ColumnType.UTF8;
        }
        return map(jdbcType, typeName);
    }

    @Override
    public boolean isUuid(String typeName) {
        return "uuid".equals(normalize(typeName));
    }

    @Override
    public boolean isZonedTimestamp(String typeName) {
        return ZONED_TIMESTAMP_TYPE_NAMES.contains(normalize(typeName));
    }

    private static String normalize(String typeName) {
        return typeName == null ? "" : typeName.trim().toLowerCase(Locale.ROOT);
    }
}
