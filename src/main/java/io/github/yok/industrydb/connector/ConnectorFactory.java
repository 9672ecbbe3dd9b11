package io.github.yok.industrydb.connector;

import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.ConnectionUris;
import io.github.yok.industrydb.config.ConnectionsProperties;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.connector.mssql.MssqlConnector;
import io.github.yok.industrydb.connector.postgres.PostgresConnector;
import io.github.yok.industrydb.connector.sqlite.SqliteConnector;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.util.MaskingLogUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory that creates a {@link CrudConnector} according to the database type.
 *
 * <p>
 * Dispatch looks at {@link ConnectionDescriptor#getType()} only:
 * </p>
 * <ul>
 * <li>{@code POSTGRES}: instantiate {@link PostgresConnector}</li>
 * <li>{@code MSSQL}: instantiate {@link MssqlConnector}</li>
 * <li>{@code SQLITE}: instantiate {@link SqliteConnector}</li>
 * </ul>
 *
 * <p>
 * The factory itself does not validate; each connector validates its descriptor and checks
 * connectivity before it is returned. The caller owns the returned connector and must close it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ConnectorFactory {

    /**
     * Creates a connector for a descriptor.
     *
     * @param descriptor connection descriptor
     * @return open connector
     * @throws IndustryDbException with {@code UNSUPPORTED_BACKEND} if no connector exists for the
     *         type, or any failure of the connector's construction
     */
    public CrudConnector create(ConnectionDescriptor descriptor) throws IndustryDbException {
        DatabaseType type = descriptor == null ? null : descriptor.getType();
        if (type == null) {
            throw IndustryDbException.unsupportedBackend("null");
        }
        log.info("Creating {} connector ({})", type, MaskingLogUtil.maskDescriptor(descriptor));
        switch (type) {
            case POSTGRES:
                return new PostgresConnector(descriptor);
            case MSSQL:
                return new MssqlConnector(descriptor);
            case SQLITE:
                return new SqliteConnector(descriptor);
            default:
                throw IndustryDbException.unsupportedBackend(type.getId());
        }
    }

    /**
     * Creates a connector from a connection URI.
     *
     * @param uri URI such as {@code postgresql://user:pw@host:5432/db}
     * @return open connector
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if the URI is invalid, or any
     *         failure of {@link #create(ConnectionDescriptor)}
     * @see ConnectionUris
     */
    public CrudConnector create(String uri) throws IndustryDbException {
        return create(ConnectionUris.fromUri(uri));
    }

    /**
     * Creates a connector for a named connection section.
     *
     * @param properties bound connection sections
     * @param name section name
     * @return open connector
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if the section is unknown or
     *         invalid, or any failure of {@link #create(ConnectionDescriptor)}
     */
    public CrudConnector create(ConnectionsProperties properties, String name)
            throws IndustryDbException {
        return create(properties.descriptor(name));
    }
}
