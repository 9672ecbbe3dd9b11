package io.github.yok.industrydb.connector.mssql;

import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.TypeMapping;
import java.util.Locale;
import java.util.Set;

/**
 * SQL Server native type mapping.
 *
 * @author Yasuharu.Okawauchi
 */
public class MssqlTypeMapping implements TypeMapping {

    static final MssqlTypeMapping INSTANCE = new MssqlTypeMapping();

    private static final String IDENTITY_SUFFIX = " identity";

    private static final Set<String> INTEGER_TYPE_NAMES =
            Set.of("tinyint", "smallint", "int", "bigint");
    private static final Set<String> FLOATING_TYPE_NAMES =
            Set.of("real", "float", "decimal", "numeric", "money", "smallmoney");
    private static final Set<String> TEXT_TYPE_NAMES = Set.of("char", "varchar", "nchar",
            "nvarchar", "text", "ntext", "xml", "sysname");
    private static final Set<String> TIMESTAMP_TYPE_NAMES =
            Set.of("datetime", "datetime2", "smalldatetime");
    // "timestamp" is the legacy name of rowversion
    private static final Set<String> BINARY_TYPE_NAMES =
            Set.of("binary", "varbinary", "image", "timestamp", "rowversion");

    @Override
    public ColumnType map(int jdbcType, String typeName) {
        String name = normalize(typeName);
        if (INTEGER_TYPE_NAMES.contains(name)) {
            return ColumnType.INT64;
        }
        if (FLOATING_TYPE_NAMES.contains(name)) {
            return ColumnType.FLOAT64;
        }
        if ("bit".equals(name)) {
            return ColumnType.BOOLEAN;
        }
        if (TEXT_TYPE_NAMES.contains(name) || isUuid(name)) {
            return ColumnType.UTF8;
        }
        if ("date".equals(name)) {
            return ColumnType.DATE;
        }
        if (TIMESTAMP_TYPE_NAMES.contains(name) || isZonedTimestamp(name)) {
            return ColumnType.TIMESTAMP;
        }
        if (BINARY_TYPE_NAMES.contains(name)) {
            return ColumnType.BINARY;
        }
        if (!name.isEmpty()) {
            // time, sql_variant, hierarchyid, geography ...
            return ColumnType.UTF8;
        }
        return TypeMapping.fromJdbcType(jdbcType);
    }

    @Override
    public boolean isUuid(String typeName) {
        return "uniqueidentifier".equals(normalize(typeName));
    }

    @Override
    public boolean isZonedTimestamp(String typeName) {
        return "datetimeoffset".equals(normalize(typeName));
    }

    // The driver reports identity columns as "int identity", "bigint identity", ...
    private static String normalize(String typeName) {
        if (typeName == null) {
            return "";
        }
        String name = typeName.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith(IDENTITY_SUFFIX)) {
            name = name.substring(0, name.length() - IDENTITY_SUFFIX.length()).trim();
        }
        return name;
    }
}
