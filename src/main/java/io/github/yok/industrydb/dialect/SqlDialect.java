package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.config.DatabaseType;
import java.sql.Types;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.codec.binary.Hex;

/**
 * SQL rendering rules of one backend.
 *
 * <p>
 * One constant exists per backend; instances are immutable and shared by every connector of that
 * backend.
 * </p>
 *
 * <table>
 * <caption>Dialect rules</caption>
 * <tr><th></th><th>POSTGRES</th><th>MSSQL</th><th>SQLITE</th></tr>
 * <tr><td>row cap</td><td>{@code ... LIMIT n}</td><td>{@code SELECT TOP n ...}</td>
 * <td>{@code ... LIMIT n}</td></tr>
 * <tr><td>booleans</td><td>{@code TRUE}/{@code FALSE}</td><td>{@code 1}/{@code 0}</td>
 * <td>{@code 1}/{@code 0}</td></tr>
 * <tr><td>identifiers</td><td>{@code "x"}</td><td>{@code [x]}</td><td>{@code "x"}</td></tr>
 * <tr><td>multi-row insert</td><td>yes</td><td>up to 1000 rows</td><td>yes</td></tr>
 * <tr><td>bind parameters</td><td>32767</td><td>2098</td><td>999</td></tr>
 * <tr><td>fraction digits of timestamp literals</td><td>9</td><td>7</td><td>9</td></tr>
 * </table>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(of = "databaseType")
@Builder(access = AccessLevel.PRIVATE)
public final class SqlDialect {

    public static final SqlDialect POSTGRES = builder()
            .databaseType(DatabaseType.POSTGRES)
            .paginationStyle(PaginationStyle.SUFFIX_LIMIT)
            .trueLiteral("TRUE")
            .falseLiteral("FALSE")
            .numericBooleans(false)
            .identifierQuoting(IdentifierQuoting.DOUBLE_QUOTES)
            .placeholderStyle(PlaceholderStyle.POSITIONAL)
            .multiRowInsert(true)
            .maxParameters(32767)
            .maxRowsPerInsert(Integer.MAX_VALUE)
            .maxFractionDigits(9)
            .nonFiniteFloats(true)
            .binaryLiteralStyle(BinaryLiteralStyle.BYTEA_ESCAPE)
            .nationalStrings(false)
            .temporalsAsText(false)
            .nativeUuid(true)
            .untypedNullJdbcType(Types.NULL)
            .build();

    public static final SqlDialect MSSQL = builder()
            .databaseType(DatabaseType.MSSQL)
            .paginationStyle(PaginationStyle.PREFIX_TOP)
            .trueLiteral("1")
            .falseLiteral("0")
            .numericBooleans(true)
            .identifierQuoting(IdentifierQuoting.SQUARE_BRACKETS)
            .placeholderStyle(PlaceholderStyle.POSITIONAL)
            .multiRowInsert(true)
            // 2100 per request, two of which the driver's sp_executesql wrapper takes
            .maxParameters(2098)
            .maxRowsPerInsert(1000)
            .maxFractionDigits(7)
            .nonFiniteFloats(false)
            .binaryLiteralStyle(BinaryLiteralStyle.HEX_PREFIX)
            .nationalStrings(true)
            .temporalsAsText(false)
            .nativeUuid(false)
            .untypedNullJdbcType(Types.VARCHAR)
            .build();

    public static final SqlDialect SQLITE = builder()
            .databaseType(DatabaseType.SQLITE)
            .paginationStyle(PaginationStyle.SUFFIX_LIMIT)
            .trueLiteral("1")
            .falseLiteral("0")
            .numericBooleans(true)
            .identifierQuoting(IdentifierQuoting.DOUBLE_QUOTES)
            .placeholderStyle(PlaceholderStyle.POSITIONAL)
            .multiRowInsert(true)
            .maxParameters(999)
            .maxRowsPerInsert(Integer.MAX_VALUE)
            .maxFractionDigits(9)
            .nonFiniteFloats(false)
            .binaryLiteralStyle(BinaryLiteralStyle.X_QUOTED)
            .nationalStrings(false)
            .temporalsAsText(true)
            .nativeUuid(false)
            .untypedNullJdbcType(Types.NULL)
            .build();

    private final DatabaseType databaseType;

    private final PaginationStyle paginationStyle;

    private final String trueLiteral;

    private final String falseLiteral;

    // Booleans are bound as 1/0 integers
    private final boolean numericBooleans;

    private final IdentifierQuoting identifierQuoting;

    private final PlaceholderStyle placeholderStyle;

    private final boolean multiRowInsert;

    private final int maxParameters;

    private final int maxRowsPerInsert;

    // datetime2 keeps 100ns ticks
    private final int maxFractionDigits;

    // NaN and infinities are representable
    private final boolean nonFiniteFloats;

    private final BinaryLiteralStyle binaryLiteralStyle;

    // String literals take the N'...' prefix
    private final boolean nationalStrings;

    // Dates and timestamps are stored and bound as ISO text
    private final boolean temporalsAsText;

    // java.util.UUID can be bound directly
    private final boolean nativeUuid;

    // JDBC type used for a null whose column type is unknown
    private final int untypedNullJdbcType;

    /**
     * Returns the dialect of a backend.
     *
     * @param type backend
     * @return dialect constant
     */
    public static SqlDialect of(DatabaseType type) {
        switch (type) {
            case POSTGRES:
                return POSTGRES;
            case MSSQL:
                return MSSQL;
            case SQLITE:
                return SQLITE;
            default:
                throw new IllegalArgumentException("No dialect for " + type);
        }
    }

    /**
     * Returns the literal of a boolean value.
     *
     * @param value value
     * @return {@link #getTrueLiteral()} or {@link #getFalseLiteral()}
     */
    public String booleanLiteral(boolean value) {
        return value ? trueLiteral : falseLiteral;
    }

    /**
     * Quotes one identifier.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    public String quote(String identifier) {
        return identifierQuoting.quote(identifier);
    }

    /**
     * Row cap placement.
     */
    public enum PaginationStyle {
        // SELECT TOP n ...
        PREFIX_TOP,
        // ... LIMIT n
        SUFFIX_LIMIT
    }

    /**
     * Bind marker style.
     */
    public enum PlaceholderStyle {
        // ?
        POSITIONAL,
        // @p1, @p2, ...
        NAMED;

        /**
         * Renders the marker of a parameter.
         *
         * @param index one based parameter index
         * @return marker text
         */
        public String marker(int index) {
            return this == POSITIONAL ? "?" : "@p" + index;
        }
    }

    /**
     * Identifier delimiters. The closing delimiter is doubled inside a quoted identifier.
     */
    @RequiredArgsConstructor
    public enum IdentifierQuoting {

        DOUBLE_QUOTES("\"", "\""),

        SQUARE_BRACKETS("[", "]");

        private final String open;
        private final String close;

        /**
         * Quotes one identifier.
         *
         * @param identifier raw identifier
         * @return quoted identifier
         */
        public String quote(String identifier) {
            return open + identifier.replace(close, close + close) + close;
        }
    }

    /**
     * Inline binary literal forms.
     */
    public enum BinaryLiteralStyle {

        // '\xCAFE'::bytea
        BYTEA_ESCAPE,

        // 0xCAFE
        HEX_PREFIX,

        // X'CAFE'
        X_QUOTED;

        /**
         * Renders bytes as a literal.
         *
         * @param bytes value
         * @return literal text
         */
        public String render(byte[] bytes) {
            String hex = Hex.encodeHexString(bytes, false);
            switch (this) {
                case BYTEA_ESCAPE:
                    return "'\\x" + hex + "'::bytea";
                case HEX_PREFIX:
                    return "0x" + hex;
                default:
                    return "X'" + hex + "'";
            }
        }
    }
}
