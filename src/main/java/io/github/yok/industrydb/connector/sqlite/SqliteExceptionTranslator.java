package io.github.yok.industrydb.connector.sqlite;

import io.github.yok.industrydb.error.AbstractSqlExceptionTranslator;
import io.github.yok.industrydb.error.ErrorKind;
import java.sql.SQLException;

/**
 * SQLite failures classified by primary result code.
 *
 * <p>
 * The driver reports the result code as {@link SQLException#getErrorCode()}; extended codes are
 * reduced to their primary code (low byte).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqliteExceptionTranslator extends AbstractSqlExceptionTranslator {

    static final int SQLITE_BUSY = 5;
    static final int SQLITE_LOCKED = 6;
    static final int SQLITE_INTERRUPT = 9;
    static final int SQLITE_IOERR = 10;
    static final int SQLITE_FULL = 13;
    static final int SQLITE_CANTOPEN = 14;
    static final int SQLITE_CONSTRAINT = 19;
    static final int SQLITE_AUTH = 23;
    static final int SQLITE_NOTADB = 26;

    @Override
    protected ErrorKind classifyNative(SQLException e) {
        int code = e.getErrorCode() & 0xff;
        if (code == SQLITE_CONSTRAINT) {
            return ErrorKind.CONSTRAINT_VIOLATION;
        }
        if (code == SQLITE_BUSY || code == SQLITE_LOCKED || code == SQLITE_INTERRUPT) {
            return ErrorKind.TIMEOUT;
        }
        if (code == SQLITE_CANTOPEN || code == SQLITE_AUTH || code == SQLITE_NOTADB) {
            return ErrorKind.CONNECTION_FAILURE;
        }
        if (code == SQLITE_IOERR || code == SQLITE_FULL) {
            return ErrorKind.IO_FAILURE;
        }
        return ErrorKind.QUERY_FAILURE;
    }
}
