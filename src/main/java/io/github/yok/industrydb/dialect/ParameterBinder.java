package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.TemporalParsers;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.Generated;

/**
 * Binds statement parameters the way a dialect expects them.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ParameterBinder {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ParameterBinder() {}

    /**
     * Binds every parameter of a statement.
     *
     * @param ps prepared statement
     * @param statement statement whose parameters are bound
     * @param dialect target dialect
     * @throws SQLException if the driver rejects a value
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for an unsupported value
     */
    public static void bindAll(PreparedStatement ps, SqlStatement statement, SqlDialect dialect)
            throws SQLException, IndustryDbException {
        List<Object> values = statement.getParameters();
        List<ColumnType> types = statement.getParameterTypes();
        for (int i = 0; i < values.size(); i++) {
            bind(ps, i + 1, values.get(i), types.get(i), dialect);
        }
    }

    /**
     * Binds one parameter.
     *
     * @param ps prepared statement
     * @param index one based parameter index
     * @param value value, may be {@code null}
     * @param type column type the value came from, {@code null} when unknown
     * @param dialect target dialect
     * @throws SQLException if the driver rejects the value
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for an unsupported Java type or a
     *         non-finite float the dialect cannot represent
     */
    public static void bind(PreparedStatement ps, int index, Object value, ColumnType type,
            SqlDialect dialect) throws SQLException, IndustryDbException {
        if (value == null) {
            if (type == null || type == ColumnType.NULL) {
                ps.setNull(index, dialect.getUntypedNullJdbcType());
            } else if (dialect.isTemporalsAsText()
                    && (type == ColumnType.DATE || type == ColumnType.TIMESTAMP)) {
                ps.setNull(index, Types.VARCHAR);
            } else if (type == ColumnType.BOOLEAN && dialect.isNumericBooleans()) {
                ps.setNull(index, Types.INTEGER);
            } else {
                ps.setNull(index, type.getJdbcType());
            }
            return;
        }
        if (value instanceof Boolean) {
            if (dialect.isNumericBooleans()) {
                ps.setInt(index, ((Boolean) value) ? 1 : 0);
            } else {
                ps.setBoolean(index, (Boolean) value);
            }
        } else if (value instanceof Long) {
            ps.setLong(index, (Long) value);
        } else if (value instanceof Integer) {
            ps.setInt(index, (Integer) value);
        } else if (value instanceof Short) {
            ps.setShort(index, (Short) value);
        } else if (value instanceof Byte) {
            ps.setByte(index, (Byte) value);
        } else if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number) && !dialect.isNonFiniteFloats()) {
                throw IndustryDbException.invalidParameter("Parameter " + index + ": " + number
                        + " is not representable on " + dialect.getDatabaseType());
            }
            ps.setDouble(index, number);
        } else if (value instanceof BigDecimal) {
            ps.setBigDecimal(index, (BigDecimal) value);
        } else if (value instanceof String) {
            ps.setString(index, (String) value);
        } else if (value instanceof UUID) {
            if (dialect.isNativeUuid()) {
                ps.setObject(index, value);
            } else {
                ps.setString(index, value.toString());
            }
        } else if (value instanceof LocalDate) {
            if (dialect.isTemporalsAsText()) {
                ps.setString(index, value.toString());
            } else {
                ps.setDate(index, Date.valueOf((LocalDate) value));
            }
        } else if (value instanceof LocalDateTime) {
            if (dialect.isTemporalsAsText()) {
                ps.setString(index, TemporalParsers.formatTimestamp((LocalDateTime) value));
            } else {
                ps.setTimestamp(index, Timestamp.valueOf((LocalDateTime) value));
            }
        } else if (value instanceof byte[]) {
            ps.setBytes(index, (byte[]) value);
        } else {
            throw IndustryDbException.invalidParameter("Parameter " + index
                    + " has unsupported type " + value.getClass().getName());
        }
    }
}
