package io.github.yok.industrydb.connector.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.connector.AbstractJdbcConnector;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.util.MaskingLogUtil;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL connector.
 *
 * <p>
 * JDBC URL: {@code jdbc:postgresql://host[:port]/database}. The descriptor timeout is passed as
 * {@code connectTimeout}. Integrated authentication leaves the password unset and lets the driver
 * negotiate GSSAPI/SSPI ({@code gsslib=auto}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PostgresConnector extends AbstractJdbcConnector {

    /**
     * Opens a pool for the descriptor and checks connectivity.
     *
     * @param descriptor PostgreSQL descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for an invalid descriptor, or
     *         {@code CONNECTION_FAILURE} if the server cannot be reached
     */
    public PostgresConnector(ConnectionDescriptor descriptor) throws IndustryDbException {
        this(openPool(poolConfig(descriptor)), timeoutOf(descriptor));
    }

    PostgresConnector(HikariDataSource dataSource, int timeoutSeconds) throws IndustryDbException {
        super(DatabaseType.POSTGRES, PostgresTypeMapping.INSTANCE,
                new PostgresExceptionTranslator(), dataSource, timeoutSeconds);
    }

    /**
     * Builds the JDBC URL.
     *
     * @param descriptor validated descriptor
     * @return JDBC URL
     */
    static String jdbcUrl(ConnectionDescriptor descriptor) {
        StringBuilder url = new StringBuilder("jdbc:postgresql://").append(descriptor.getHost());
        if (descriptor.getPort() != null) {
            url.append(':').append(descriptor.getPort());
        }
        url.append('/').append(URLEncoder.encode(descriptor.getDatabase(), StandardCharsets.UTF_8)
                .replace("+", "%20"));
        return url.toString();
    }

    /**
     * Derives the pool settings.
     *
     * @param descriptor descriptor to validate and convert
     * @return pool settings
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for an invalid descriptor
     */
    static HikariConfig poolConfig(ConnectionDescriptor descriptor) throws IndustryDbException {
        requireDescriptor(descriptor, DatabaseType.POSTGRES);
        log.debug("PostgreSQL connection: {}", MaskingLogUtil.maskDescriptor(descriptor));
        HikariConfig config = basePoolConfig(descriptor, jdbcUrl(descriptor));
        Properties props = config.getDataSourceProperties();
        props.putIfAbsent("connectTimeout", String.valueOf(timeoutOf(descriptor)));
        props.putIfAbsent("ApplicationName", "industrydb");
        if (descriptor.usesIntegratedAuth()) {
            props.putIfAbsent("gsslib", "auto");
        }
        return config;
    }
}
