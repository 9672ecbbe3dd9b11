package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.TemporalParsers;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Generated;

/**
 * Renders values as inline SQL literals.
 *
 * <p>
 * Used for {@code UPDATE ... SET} assignments. Text is single-quoted with embedded quotes
 * doubled; booleans and binary values follow the dialect; temporal values are quoted ISO text
 * with fractional seconds cut to the digits the dialect keeps.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class LiteralRenderer {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LiteralRenderer() {}

    /**
     * Renders one value.
     *
     * @param value value, may be {@code null}
     * @param dialect target dialect
     * @return literal text
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for an unsupported Java type or a
     *         non-finite float the dialect cannot represent
     */
    public static String render(Object value, SqlDialect dialect) throws IndustryDbException {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean) {
            return dialect.booleanLiteral((Boolean) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            return renderFloat(((Number) value).doubleValue(), dialect);
        }
        if (value instanceof String) {
            return quoteText((String) value, dialect);
        }
        if (value instanceof UUID) {
            return quoteText(value.toString(), dialect);
        }
        if (value instanceof LocalDate) {
            return "'" + value + "'";
        }
        if (value instanceof LocalDateTime) {
            String text = truncateFraction(
                    TemporalParsers.formatTimestamp((LocalDateTime) value), dialect);
            return "'" + (dialect.isTemporalsAsText() ? text : text.replace(' ', 'T')) + "'";
        }
        if (value instanceof byte[]) {
            return dialect.getBinaryLiteralStyle().render((byte[]) value);
        }
        throw IndustryDbException.invalidParameter(
                "Cannot render " + value.getClass().getName() + " as a SQL literal");
    }

    private static String truncateFraction(String timestamp, SqlDialect dialect) {
        int dot = timestamp.lastIndexOf('.');
        if (dot < 0 || timestamp.length() - dot - 1 <= dialect.getMaxFractionDigits()) {
            return timestamp;
        }
        return timestamp.substring(0, dot + 1 + dialect.getMaxFractionDigits());
    }

    private static String renderFloat(double value, SqlDialect dialect)
            throws IndustryDbException {
        if (Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (!dialect.isNonFiniteFloats()) {
            throw IndustryDbException.invalidParameter(
                    value + " is not representable on " + dialect.getDatabaseType());
        }
        String text;
        if (Double.isNaN(value)) {
            text = "NaN";
        } else {
            text = value > 0 ? "Infinity" : "-Infinity";
        }
        return "'" + text + "'::float8";
    }

    private static String quoteText(String text, SqlDialect dialect) {
        String quoted = "'" + text.replace("'", "''") + "'";
        return dialect.isNationalStrings() ? "N" + quoted : quoted;
    }
}
