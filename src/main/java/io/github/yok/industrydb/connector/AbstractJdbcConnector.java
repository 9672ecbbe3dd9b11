package io.github.yok.industrydb.connector;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool.PoolInitializationException;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.ConnectionDescriptors;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.dialect.CrudRequest;
import io.github.yok.industrydb.dialect.CrudSqlBuilder;
import io.github.yok.industrydb.dialect.ParameterBinder;
import io.github.yok.industrydb.dialect.SqlDialect;
import io.github.yok.industrydb.dialect.SqlStatement;
import io.github.yok.industrydb.error.ErrorKind;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.error.SqlExceptionTranslator;
import io.github.yok.industrydb.types.ColumnarBatch;
import io.github.yok.industrydb.types.ColumnarResultReader;
import io.github.yok.industrydb.types.TypeMapping;
import io.github.yok.industrydb.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Shared JDBC mechanics of the backend connectors.
 *
 * <p>
 * Each instance owns one {@link HikariDataSource}. Every operation checks the closed state first,
 * then borrows a pooled connection for exactly the duration of the call and returns it through
 * try-with-resources, also on failure. Statements run in auto-commit mode with the connector's
 * timeout as query timeout; the same timeout bounds the wait for a free pooled connection.
 * </p>
 *
 * <p>
 * Driver failures are translated by the backend's {@link SqlExceptionTranslator} before leaving
 * this class.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractJdbcConnector implements CrudConnector {

    /**
     * Timeout used when a descriptor does not set one.
     */
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    /**
     * Extension key prefix of pool settings.
     */
    public static final String POOL_PREFIX = "pool.";

    static final String POOL_MAX_SIZE = POOL_PREFIX + "max-size";
    static final String POOL_MIN_IDLE = POOL_PREFIX + "min-idle";

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final DatabaseType type;

    @Getter
    private final SqlDialect dialect;

    private final SqlExceptionTranslator translator;

    private final ColumnarResultReader reader;

    private final HikariDataSource dataSource;

    @Getter
    private final int timeoutSeconds;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Wraps an opened pool and verifies that it can reach the database.
     *
     * @param type backend
     * @param mapping native type mapping of the backend
     * @param translator exception translator of the backend
     * @param dataSource pool owned by this connector from now on
     * @param timeoutSeconds per operation timeout, {@code 0} for none
     * @throws IndustryDbException with {@code CONNECTION_FAILURE} if the database cannot be
     *         reached; the pool is closed in that case
     */
    protected AbstractJdbcConnector(DatabaseType type, TypeMapping mapping,
            SqlExceptionTranslator translator, HikariDataSource dataSource, int timeoutSeconds)
            throws IndustryDbException {
        this.type = type;
        this.dialect = SqlDialect.of(type);
        this.translator = translator;
        this.reader = new ColumnarResultReader(mapping);
        this.dataSource = dataSource;
        this.timeoutSeconds = timeoutSeconds;
        verifyConnectivity();
    }

    @Override
    public DatabaseType backendType() {
        return type;
    }

    @Override
    public ColumnarBatch execute(String sql) throws IndustryDbException {
        return execute(sql, Collections.emptyList());
    }

    @Override
    public ColumnarBatch execute(String sql, List<?> params) throws IndustryDbException {
        ensureOpen();
        return query("Statement", SqlStatement.of(sql, nullToEmpty(params)));
    }

    @Override
    public OperationOutcome executeUpdate(String sql, List<?> params) throws IndustryDbException {
        ensureOpen();
        SqlStatement statement = SqlStatement.of(sql, nullToEmpty(params));
        try (Connection connection = borrow()) {
            return OperationOutcome.success(update(connection, statement));
        } catch (SQLException e) {
            throw translator.translate("Update", e);
        }
    }

    @Override
    public OperationOutcome insert(String table, ColumnarBatch batch) throws IndustryDbException {
        ensureOpen();
        if (batch == null) {
            throw IndustryDbException.invalidParameter("Batch to insert must not be null");
        }
        List<SqlStatement> statements =
                CrudSqlBuilder.buildInsert(new CrudRequest.Insert(table, batch), dialect);
        if (statements.isEmpty()) {
            return OperationOutcome.success(0);
        }
        int columnCount = batch.getColumnCount();
        long applied = 0;
        long attempted = 0;
        try (Connection connection = borrow()) {
            for (SqlStatement statement : statements) {
                attempted += statement.getParameters().size() / columnCount;
                try {
                    applied += update(connection, statement);
                } catch (SQLException e) {
                    IndustryDbException translated =
                            translator.translate("Insert into " + table, e);
                    String detail = translated.getDetail() + " (" + applied + " of " + attempted
                            + " attempted rows applied, " + batch.getRowCount() + " requested)";
                    throw new IndustryDbException(translated.getKind(), detail, e,
                            OperationOutcome.partial(applied, attempted, detail));
                }
            }
        } catch (SQLException e) {
            throw translator.translate("Insert into " + table, e);
        }
        log.debug("[{}] inserted {} rows into {} with {} statement(s)", type, applied, table,
                statements.size());
        return OperationOutcome.success(applied);
    }

    @Override
    public ColumnarBatch select(String table, List<String> columns, String predicate,
            List<?> params, Long rowCap) throws IndustryDbException {
        ensureOpen();
        CrudRequest.Select.SelectBuilder request =
                CrudRequest.Select.builder().table(table).predicate(predicate).rowCap(rowCap);
        if (columns != null) {
            request.columns(columns);
        }
        if (params != null) {
            request.params(params);
        }
        return query("Select from " + table, CrudSqlBuilder.buildSelect(request.build(), dialect));
    }

    @Override
    public OperationOutcome update(String table, Map<String, ?> values, String predicate,
            List<?> params) throws IndustryDbException {
        ensureOpen();
        CrudRequest.Update.UpdateBuilder request =
                CrudRequest.Update.builder().table(table).predicate(predicate);
        if (values != null) {
            request.values(values);
        }
        if (params != null) {
            request.params(params);
        }
        return mutate("Update of " + table, CrudSqlBuilder.buildUpdate(request.build(), dialect));
    }

    @Override
    public OperationOutcome delete(String table, String predicate, List<?> params)
            throws IndustryDbException {
        ensureOpen();
        CrudRequest.Delete.DeleteBuilder request =
                CrudRequest.Delete.builder().table(table).predicate(predicate);
        if (params != null) {
            request.params(params);
        }
        return mutate("Delete from " + table, CrudSqlBuilder.buildDelete(request.build(), dialect));
    }

    @Override
    public boolean isAlive() {
        if (closed.get()) {
            return false;
        }
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(timeoutSeconds);
        } catch (SQLException | RuntimeException e) {
            log.debug("[{}] liveness probe failed: {}", type, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            dataSource.close();
            log.info("[{}] pool closed: {}", type, dataSource.getPoolName());
        } catch (RuntimeException e) {
            log.warn("[{}] pool close failed: {}", type, e.getMessage(), e);
        }
    }

    private void ensureOpen() throws IndustryDbException {
        if (closed.get()) {
            throw IndustryDbException.alreadyClosed(type.getId());
        }
    }

    private void verifyConnectivity() throws IndustryDbException {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(timeoutSeconds)) {
                throw new IndustryDbException(ErrorKind.CONNECTION_FAILURE,
                        "Connectivity check failed for " + type);
            }
        } catch (SQLException e) {
            closeAfterFailedCheck();
            throw new IndustryDbException(ErrorKind.CONNECTION_FAILURE,
                    "Connectivity check failed for " + type + ": " + e.getMessage(), e);
        } catch (IndustryDbException e) {
            closeAfterFailedCheck();
            throw e;
        }
    }

    private void closeAfterFailedCheck() {
        closed.set(true);
        dataSource.close();
    }

    // A checkout that fails once close() has begun is reported as ALREADY_CLOSED
    private Connection borrow() throws SQLException, IndustryDbException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            if (closed.get()) {
                throw new IndustryDbException(ErrorKind.ALREADY_CLOSED,
                        type.getId() + " connector", e);
            }
            throw e;
        }
    }

    private ColumnarBatch query(String operation, SqlStatement statement)
            throws IndustryDbException {
        log.debug("[{}] {}", type, statement.getSql());
        try (Connection connection = borrow()) {
            if (statement.getParameters().isEmpty()) {
                try (Statement plain = connection.createStatement()) {
                    plain.setQueryTimeout(timeoutSeconds);
                    return readFirstResult(plain, plain.execute(statement.getSql()));
                }
            }
            try (PreparedStatement ps = connection.prepareStatement(statement.getSql())) {
                ps.setQueryTimeout(timeoutSeconds);
                ParameterBinder.bindAll(ps, statement, dialect);
                return readFirstResult(ps, ps.execute());
            }
        } catch (SQLException e) {
            throw translator.translate(operation, e);
        }
    }

    // Skips leading update counts, as SQL Server reports them before a trigger's or batch's rows
    private ColumnarBatch readFirstResult(Statement statement, boolean resultSet)
            throws SQLException, IndustryDbException {
        boolean current = resultSet;
        while (true) {
            if (current) {
                try (ResultSet rs = statement.getResultSet()) {
                    return reader.read(rs);
                }
            }
            if (statement.getUpdateCount() == -1) {
                return ColumnarBatch.empty();
            }
            current = statement.getMoreResults();
        }
    }

    private OperationOutcome mutate(String operation, SqlStatement statement)
            throws IndustryDbException {
        try (Connection connection = borrow()) {
            return OperationOutcome.success(update(connection, statement));
        } catch (SQLException e) {
            throw translator.translate(operation, e);
        }
    }

    private long update(Connection connection, SqlStatement statement)
            throws SQLException, IndustryDbException {
        log.debug("[{}] {}", type, statement.getSql());
        try (PreparedStatement ps = connection.prepareStatement(statement.getSql())) {
            ps.setQueryTimeout(timeoutSeconds);
            ParameterBinder.bindAll(ps, statement, dialect);
            return Math.max(0, ps.executeUpdate());
        }
    }

    private static List<?> nullToEmpty(List<?> params) {
        return params == null ? Collections.emptyList() : params;
    }

    /**
     * Validates a descriptor handed to a backend connector.
     *
     * @param descriptor descriptor
     * @param expected backend of the connector
     * @return the descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if it is invalid or of another
     *         backend
     */
    protected static ConnectionDescriptor requireDescriptor(ConnectionDescriptor descriptor,
            DatabaseType expected) throws IndustryDbException {
        ConnectionDescriptors.validate(descriptor);
        if (descriptor.getType() != expected) {
            throw IndustryDbException.configuration(
                    "Descriptor of type " + descriptor.getType() + " given to " + expected
                            + " connector");
        }
        return descriptor;
    }

    /**
     * Returns the timeout of a descriptor.
     *
     * @param descriptor descriptor
     * @return timeout in seconds
     */
    protected static int timeoutOf(ConnectionDescriptor descriptor) {
        Integer timeout = descriptor.getTimeoutSeconds();
        return timeout == null ? DEFAULT_TIMEOUT_SECONDS : timeout;
    }

    /**
     * Creates the pool settings shared by all backends.
     *
     * <p>
     * Extension entries starting with {@value #POOL_PREFIX} tune the pool; every other entry is
     * passed to the JDBC driver as a connection property.
     * </p>
     *
     * @param descriptor validated descriptor
     * @param jdbcUrl JDBC URL derived from the descriptor
     * @return pool settings
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for a malformed or unknown
     *         pool setting
     */
    protected static HikariConfig basePoolConfig(ConnectionDescriptor descriptor, String jdbcUrl)
            throws IndustryDbException {
        HikariConfig config = new HikariConfig();
        config.setPoolName("industrydb-" + descriptor.getType().getId() + "-"
                + POOL_SEQUENCE.incrementAndGet());
        config.setJdbcUrl(jdbcUrl);
        if (descriptor.getUsername() != null) {
            config.setUsername(descriptor.getUsername());
        }
        if (descriptor.getPassword() != null) {
            config.setPassword(descriptor.getPassword());
        }
        config.setAutoCommit(true);
        config.setConnectionTimeout(TimeUnit.SECONDS.toMillis(timeoutOf(descriptor)));
        for (Map.Entry<String, String> entry : descriptor.getExtensions().entrySet()) {
            String key = entry.getKey();
            if (POOL_MAX_SIZE.equals(key)) {
                int size = poolInt(key, entry.getValue());
                if (size < 1) {
                    throw IndustryDbException.configuration(key + " must be at least 1: " + size);
                }
                config.setMaximumPoolSize(size);
            } else if (POOL_MIN_IDLE.equals(key)) {
                config.setMinimumIdle(poolInt(key, entry.getValue()));
            } else if (key.startsWith(POOL_PREFIX)) {
                throw IndustryDbException.configuration("Unknown pool setting '" + key + "'");
            } else {
                config.addDataSourceProperty(key, entry.getValue());
            }
        }
        return config;
    }

    /**
     * Opens a pool, failing fast when the database cannot be reached.
     *
     * @param config pool settings
     * @return opened pool
     * @throws IndustryDbException with {@code CONNECTION_FAILURE} if the pool cannot open its first
     *         connection
     */
    protected static HikariDataSource openPool(HikariConfig config) throws IndustryDbException {
        String maskedUrl = MaskingLogUtil.maskUrl(config.getJdbcUrl());
        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("Opened pool {}: {}", config.getPoolName(), maskedUrl);
            return dataSource;
        } catch (PoolInitializationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IndustryDbException(ErrorKind.CONNECTION_FAILURE, "Cannot open pool for "
                    + maskedUrl + ": " + maskMessage(cause, config.getJdbcUrl(), maskedUrl), e);
        } catch (RuntimeException e) {
            // no suitable driver, rejected pool settings
            throw new IndustryDbException(ErrorKind.CONFIGURATION_INVALID,
                    "Cannot configure pool for " + maskedUrl + ": "
                            + maskMessage(e, config.getJdbcUrl(), maskedUrl),
                    e);
        }
    }

    // Hikari and the drivers quote the raw URL in their messages
    private static String maskMessage(Throwable e, String url, String maskedUrl) {
        return StringUtils.replace(e.getMessage(), url, maskedUrl);
    }

    private static int poolInt(String key, String value) throws IndustryDbException {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw IndustryDbException.configuration(key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw IndustryDbException.configuration("Invalid " + key + ": " + value);
        }
    }
}
