package io.github.yok.industrydb.config;

import io.github.yok.industrydb.error.IndustryDbException;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable description of how to reach one database instance.
 *
 * <p>
 * Which fields are meaningful depends on {@link #getType()}: server backends use the network
 * address fields, SQLite uses {@link #getPath()} only. Use
 * {@link ConnectionDescriptorBuilder#buildValidated()} to construct and validate in one step, or
 * {@link ConnectionDescriptors#validate} afterwards.
 * </p>
 *
 * <pre>
 * ConnectionDescriptor pg = ConnectionDescriptor.builder()
 *         .type(DatabaseType.POSTGRES)
 *         .host("localhost").port(5432).database("app")
 *         .username("app").password("secret")
 *         .buildValidated();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class ConnectionDescriptor {

    /**
     * Sentinel SQLite path selecting a private in-memory database.
     */
    public static final String IN_MEMORY = ":memory:";

    // Backend tag (required)
    DatabaseType type;

    // Host name or server address (SQL Server instance names such as host\SQLEXPRESS included)
    String host;

    Integer port;

    String database;

    String username;

    @ToString.Exclude
    String password;

    // SQLite database file, or IN_MEMORY
    String path;

    // Kerberos/GSS for PostgreSQL, Windows integrated security for SQL Server
    Boolean integratedAuth;

    // Per-operation timeout in seconds, also used as the pool checkout timeout
    Integer timeoutSeconds;

    // Backend specific tuning; "pool." keys tune the pool, others go to the JDBC driver
    @Singular
    Map<String, String> extensions;

    /**
     * Returns whether platform-integrated authentication is requested.
     *
     * @return {@code true} only when the flag is explicitly set to true
     */
    public boolean usesIntegratedAuth() {
        return Boolean.TRUE.equals(integratedAuth);
    }

    /**
     * Returns whether this descriptor points at the SQLite in-memory sentinel.
     *
     * @return {@code true} for {@value #IN_MEMORY}
     */
    public boolean isInMemory() {
        return type == DatabaseType.SQLITE && IN_MEMORY.equals(path);
    }

    /**
     * Creates an unvalidated PostgreSQL descriptor.
     *
     * @param host host name
     * @param port port
     * @param database database name
     * @param username user name
     * @param password password
     * @return descriptor
     */
    public static ConnectionDescriptor postgres(String host, int port, String database,
            String username, String password) {
        return builder().type(DatabaseType.POSTGRES).host(host).port(port).database(database)
                .username(username).password(password).build();
    }

    /**
     * Creates an unvalidated SQL Server descriptor using SQL authentication.
     *
     * @param server server address
     * @param database database name
     * @param username user name
     * @param password password
     * @return descriptor
     */
    public static ConnectionDescriptor mssql(String server, String database, String username,
            String password) {
        return builder().type(DatabaseType.MSSQL).host(server).database(database)
                .username(username).password(password).build();
    }

    /**
     * Creates an unvalidated SQLite descriptor.
     *
     * @param path database file path, or {@value #IN_MEMORY}
     * @return descriptor
     */
    public static ConnectionDescriptor sqlite(String path) {
        return builder().type(DatabaseType.SQLITE).path(path).build();
    }

    /**
     * Builder with a validating terminal operation.
     */
    public static class ConnectionDescriptorBuilder {

        /**
         * Builds the descriptor and validates it.
         *
         * @return validated descriptor
         * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if validation fails
         */
        public ConnectionDescriptor buildValidated() throws IndustryDbException {
            ConnectionDescriptor descriptor = build();
            ConnectionDescriptors.validate(descriptor);
            return descriptor;
        }
    }
}
