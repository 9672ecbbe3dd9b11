package io.github.yok.industrydb.connector.postgres;

import io.github.yok.industrydb.error.AbstractSqlExceptionTranslator;
import io.github.yok.industrydb.error.ErrorKind;
import java.sql.SQLException;
import java.util.Set;

/**
 * PostgreSQL failures classified by SQLState.
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresExceptionTranslator extends AbstractSqlExceptionTranslator {

    // query_canceled, raised when the statement timeout fires
    private static final String QUERY_CANCELED = "57014";

    // invalid_catalog_name, the database does not exist
    private static final String INVALID_CATALOG_NAME = "3D000";

    // disk_full
    private static final String DISK_FULL = "53100";

    // admin_shutdown, crash_shutdown, cannot_connect_now
    private static final Set<String> SERVER_SHUTDOWN = Set.of("57P01", "57P02", "57P03");

    private static final Set<String> CONNECTION_CLASSES = Set.of("08", "28");

    @Override
    protected ErrorKind classifyNative(SQLException e) {
        String state = e.getSQLState();
        String stateClass = sqlStateClass(e);
        if (QUERY_CANCELED.equals(state)) {
            return ErrorKind.TIMEOUT;
        }
        if ("23".equals(stateClass)) {
            return ErrorKind.CONSTRAINT_VIOLATION;
        }
        if (CONNECTION_CLASSES.contains(stateClass) || INVALID_CATALOG_NAME.equals(state)
                || SERVER_SHUTDOWN.contains(state)) {
            return ErrorKind.CONNECTION_FAILURE;
        }
        if ("58".equals(stateClass) || DISK_FULL.equals(state)) {
            return ErrorKind.IO_FAILURE;
        }
        return ErrorKind.QUERY_FAILURE;
    }
}
