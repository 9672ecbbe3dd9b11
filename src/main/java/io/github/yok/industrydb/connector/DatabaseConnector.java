package io.github.yok.industrydb.connector;

import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.util.List;

/**
 * Raw SQL access to one database.
 *
 * <p>
 * A connector is open from construction until {@link #close()}; afterwards every operation fails
 * with {@link io.github.yok.industrydb.error.ErrorKind#ALREADY_CLOSED} without touching the
 * database. Implementations are safe for concurrent use; concurrency is bounded by the connector's
 * pool.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DatabaseConnector extends AutoCloseable {

    /**
     * Executes a statement without parameters.
     *
     * @param sql SQL text
     * @return rows produced, or an empty batch for statements producing none
     * @throws IndustryDbException if the statement fails or the connector is closed
     */
    ColumnarBatch execute(String sql) throws IndustryDbException;

    /**
     * Executes a statement with positional {@code ?} parameters.
     *
     * @param sql SQL text
     * @param params bind values in marker order
     * @return rows produced, or an empty batch for statements producing none
     * @throws IndustryDbException if the statement fails, a parameter is unsupported or the
     *         connector is closed
     */
    ColumnarBatch execute(String sql, List<?> params) throws IndustryDbException;

    /**
     * Executes a mutating statement with positional parameters.
     *
     * @param sql SQL text
     * @param params bind values in marker order
     * @return rows affected
     * @throws IndustryDbException if the statement fails or the connector is closed
     */
    OperationOutcome executeUpdate(String sql, List<?> params) throws IndustryDbException;

    /**
     * Probes the database. Never throws.
     *
     * @return {@code true} if a trivial round trip succeeded
     */
    boolean isAlive();

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return {@code true} once closed
     */
    boolean isClosed();

    /**
     * Returns the backend this connector talks to.
     *
     * @return backend
     */
    DatabaseType backendType();

    /**
     * Releases the pool. Idempotent and never throws.
     */
    @Override
    void close();
}
