package io.github.yok.industrydb.connector.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.connector.AbstractJdbcConnector;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.util.MaskingLogUtil;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * SQLite connector.
 *
 * <p>
 * JDBC URL: {@code jdbc:sqlite:path}. The descriptor timeout becomes the driver's
 * {@code busy_timeout}, so a locked database is retried that long before
 * {@link io.github.yok.industrydb.error.ErrorKind#TIMEOUT}.
 * </p>
 *
 * <p>
 * Every JDBC connection to {@value ConnectionDescriptor#IN_MEMORY} opens its own empty database.
 * For that path the pool is pinned to a single connection that is never retired, so the in-memory
 * database lives exactly as long as the connector; concurrent calls queue for that connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqliteConnector extends AbstractJdbcConnector {

    /**
     * Opens a pool for the descriptor and checks that the database can be opened.
     *
     * @param descriptor SQLite descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for an invalid descriptor, or
     *         {@code CONNECTION_FAILURE} if the file cannot be opened
     */
    public SqliteConnector(ConnectionDescriptor descriptor) throws IndustryDbException {
        this(openPool(poolConfig(descriptor)), timeoutOf(descriptor));
    }

    SqliteConnector(HikariDataSource dataSource, int timeoutSeconds) throws IndustryDbException {
        super(DatabaseType.SQLITE, SqliteTypeMapping.INSTANCE, new SqliteExceptionTranslator(),
                dataSource, timeoutSeconds);
    }

    /**
     * Builds the JDBC URL.
     *
     * @param descriptor validated descriptor
     * @return JDBC URL
     */
    static String jdbcUrl(ConnectionDescriptor descriptor) {
        return "jdbc:sqlite:" + descriptor.getPath();
    }

    /**
     * Derives the pool settings.
     *
     * @param descriptor descriptor to validate and convert
     * @return pool settings
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for an invalid descriptor
     */
    static HikariConfig poolConfig(ConnectionDescriptor descriptor) throws IndustryDbException {
        requireDescriptor(descriptor, DatabaseType.SQLITE);
        log.debug("SQLite connection: {}", MaskingLogUtil.maskDescriptor(descriptor));
        HikariConfig config = basePoolConfig(descriptor, jdbcUrl(descriptor));
        config.getDataSourceProperties().putIfAbsent("busy_timeout",
                String.valueOf(TimeUnit.SECONDS.toMillis(timeoutOf(descriptor))));
        if (descriptor.isInMemory()) {
            config.setMaximumPoolSize(1);
            config.setMinimumIdle(1);
            config.setMaxLifetime(0);
            config.setIdleTimeout(0);
        }
        return config;
    }
}
