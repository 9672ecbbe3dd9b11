package io.github.yok.industrydb.error;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Translator base applying the standard JDBC exception subclasses before the backend's own table.
 *
 * <p>
 * Order of classification:
 * </p>
 * <ol>
 * <li>{@link SQLTransientConnectionException} raised by the pool on checkout: its
 * {@link SQLException} cause when there is one (the driver could not connect), otherwise
 * {@link ErrorKind#TIMEOUT} (no handle became free in time).</li>
 * <li>Standard subclasses: timeout, integrity constraint, authorization, non-transient connection,
 * syntax.</li>
 * <li>{@link #classifyNative(SQLException)} of the backend.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractSqlExceptionTranslator implements SqlExceptionTranslator {

    @Override
    public IndustryDbException translate(String operation, SQLException e) {
        ErrorKind kind = classify(e);
        String detail = operation + " failed: " + describe(e);
        log.warn("{} (SQLState={}, errorCode={}) -> {}", detail, e.getSQLState(),
                e.getErrorCode(), kind);
        return new IndustryDbException(kind, detail, e);
    }

    @Override
    public ErrorKind classify(SQLException e) {
        if (e instanceof SQLTransientConnectionException) {
            if (e.getCause() instanceof SQLException) {
                return classify((SQLException) e.getCause());
            }
            return ErrorKind.TIMEOUT;
        }
        if (e instanceof SQLTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return ErrorKind.CONSTRAINT_VIOLATION;
        }
        if (e instanceof SQLInvalidAuthorizationSpecException
                || e instanceof SQLNonTransientConnectionException) {
            return ErrorKind.CONNECTION_FAILURE;
        }
        if (e instanceof SQLSyntaxErrorException) {
            return ErrorKind.QUERY_FAILURE;
        }
        return classifyNative(e);
    }

    /**
     * Classifies by the backend's SQLState and vendor codes.
     *
     * @param e driver exception not matched by a standard subclass
     * @return error kind, {@link ErrorKind#QUERY_FAILURE} when nothing matches
     */
    protected abstract ErrorKind classifyNative(SQLException e);

    /**
     * Returns the first two characters of the SQLState.
     *
     * @param e driver exception
     * @return SQLState class, or an empty string when the driver reported none
     */
    protected static String sqlStateClass(SQLException e) {
        String state = e.getSQLState();
        return state == null || state.length() < 2 ? "" : state.substring(0, 2);
    }

    private static String describe(SQLException e) {
        String message = e.getMessage();
        if (StringUtils.isBlank(message) && e.getCause() != null) {
            message = e.getCause().getMessage();
        }
        return StringUtils.defaultIfBlank(message, e.getClass().getSimpleName());
    }
}
