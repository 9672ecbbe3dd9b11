package io.github.yok.industrydb.connector.mssql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.connector.AbstractJdbcConnector;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.util.MaskingLogUtil;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Microsoft SQL Server connector.
 *
 * <p>
 * JDBC URL: {@code jdbc:sqlserver://server[:port];databaseName=db[;integratedSecurity=true]}.
 * Named instances are given as {@code host\instance}. The descriptor timeout is passed as
 * {@code loginTimeout}. Driver options such as {@code encrypt}, {@code trustServerCertificate} or
 * {@code authenticationScheme} are taken from the descriptor's extension map.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MssqlConnector extends AbstractJdbcConnector {

    /**
     * Opens a pool for the descriptor and checks connectivity.
     *
     * @param descriptor SQL Server descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} for an invalid descriptor, or
     *         {@code CONNECTION_FAILURE} if the server cannot be reached
     */
    public MssqlConnector(ConnectionDescriptor descriptor) throws IndustryDbException {
        this(openPool(poolConfig(descriptor)), timeoutOf(descriptor));
    }

    MssqlConnector(HikariDataSource dataSource, int timeoutSeconds) throws IndustryDbException {
        super(DatabaseType.MSSQL, MssqlTypeMapping.INSTANCE, new MssqlExceptionTranslator(),
                dataSource, timeoutSeconds);
    }

    /**
     * Builds the JDBC URL.
     *
     * @param descriptor validated descriptor
     * @return JDBC URL
     */
    static String jdbcUrl(ConnectionDescriptor descriptor) {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://").append(descriptor.getHost());
        if (descriptor.getPort() != null) {
            url.append(':').append(descriptor.getPort());
        }
        url.append(";databaseName=").append(escapeValue(descriptor.getDatabase()));
        if (descriptor.usesIntegratedAuth()) {
            url.append(";integratedSecurity=true");
        }
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
        requireDescriptor(descriptor, DatabaseType.MSSQL);
        log.debug("SQL Server connection: {}", MaskingLogUtil.maskDescriptor(descriptor));
        HikariConfig config = basePoolConfig(descriptor, jdbcUrl(descriptor));
        Properties props = config.getDataSourceProperties();
        props.putIfAbsent("loginTimeout", String.valueOf(timeoutOf(descriptor)));
        props.putIfAbsent("applicationName", "industrydb");
        return config;
    }

    // Values containing ';' or braces are wrapped in braces with '}' doubled
    private static String escapeValue(String value) {
        if (StringUtils.containsAny(value, ';', '{', '}')) {
            return "{" + value.replace("}", "}}") + "}";
        }
        return value;
    }
}
