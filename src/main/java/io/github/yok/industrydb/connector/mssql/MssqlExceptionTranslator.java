package io.github.yok.industrydb.connector.mssql;

import io.github.yok.industrydb.error.AbstractSqlExceptionTranslator;
import io.github.yok.industrydb.error.ErrorKind;
import java.sql.SQLException;
import java.util.Set;

/**
 * SQL Server failures classified by vendor error number, then SQLState.
 *
 * @author Yasuharu.Okawauchi
 */
public class MssqlExceptionTranslator extends AbstractSqlExceptionTranslator {

    // 2627 primary key / unique constraint, 2601 unique index, 547 foreign key / check,
    // 515 null into not-null column
    private static final Set<Integer> CONSTRAINT_ERRORS = Set.of(2627, 2601, 547, 515);

    // 18456 login failed, 4060 cannot open database, 53 / 233 / 10054 network
    private static final Set<Integer> CONNECTION_ERRORS = Set.of(18456, 4060, 53, 233, 10054);

    // 1222 lock request timeout
    private static final Set<Integer> TIMEOUT_ERRORS = Set.of(1222);

    // Operation canceled, reported on query timeout
    private static final String OPERATION_CANCELED = "HY008";

    @Override
    protected ErrorKind classifyNative(SQLException e) {
        int code = e.getErrorCode();
        String stateClass = sqlStateClass(e);
        if (CONSTRAINT_ERRORS.contains(code) || "23".equals(stateClass)) {
            return ErrorKind.CONSTRAINT_VIOLATION;
        }
        if (CONNECTION_ERRORS.contains(code) || "08".equals(stateClass)) {
            return ErrorKind.CONNECTION_FAILURE;
        }
        if (TIMEOUT_ERRORS.contains(code) || OPERATION_CANCELED.equals(e.getSQLState())) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.QUERY_FAILURE;
    }
}
