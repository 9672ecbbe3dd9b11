package io.github.yok.industrydb.connector.sqlite;

import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.TypeMapping;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * SQLite declared-type mapping.
 *
 * <p>
 * SQLite stores values dynamically, so the declared type is matched by substring in the spirit of
 * SQLite's own affinity rules, with the temporal and boolean names recognised first. A column
 * without a declared type (an expression, or the value type {@code NULL} reported by the driver)
 * maps to {@link ColumnType#NULL} and is typed from its values while reading. A column whose
 * values do not all fit its type is read as text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqliteTypeMapping implements TypeMapping {

    static final SqliteTypeMapping INSTANCE = new SqliteTypeMapping();

    @Override
    public ColumnType map(int jdbcType, String typeName) {
        if (StringUtils.isBlank(typeName)) {
            return ColumnType.NULL;
        }
        String name = typeName.trim().toUpperCase(Locale.ROOT);
        if ("NULL".equals(name)) {
            return ColumnType.NULL;
        }
        if (name.contains("DATETIME") || name.contains("TIMESTAMP")) {
            return ColumnType.TIMESTAMP;
        }
        if (name.contains("DATE")) {
            return ColumnType.DATE;
        }
        if (name.contains("BOOL")) {
            return ColumnType.BOOLEAN;
        }
        if (name.contains("INT")) {
            return ColumnType.INT64;
        }
        if (name.contains("CHAR") || name.contains("CLOB") || name.contains("TEXT")) {
            return ColumnType.UTF8;
        }
        if (name.contains("BLOB")) {
            return ColumnType.BINARY;
        }
        if (name.contains("REAL") || name.contains("FLOA") || name.contains("DOUB")
                || name.contains("NUMERIC") || name.contains("DECIMAL")) {
            return ColumnType.FLOAT64;
        }
        return ColumnType.UTF8;
    }

    @Override
    public boolean readsMixedColumnsAsText() {
        return true;
    }

    @Override
    public boolean isUuid(String typeName) {
        return "UUID".equalsIgnoreCase(StringUtils.trim(typeName));
    }
}
