package io.github.yok.industrydb.config;

import io.github.yok.industrydb.error.IndustryDbException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Named connection sections bound from an already parsed configuration source.
 *
 * <p>
 * The file format (YAML, properties, TOML converted by the caller, ...) is handled by Spring's
 * property binding or by the caller; this class only consumes the resulting section table.
 * </p>
 *
 * <pre>
 * industrydb:
 *   connections:
 *     warehouse:
 *       type: postgres
 *       host: localhost
 *       port: 5432
 *       database: analytics
 *       username: report
 *       password: secret
 *     plant:
 *       type: mssql
 *       server: plant-sql\SQLEXPRESS
 *       database: mes
 *       trusted-connection: true
 *     local:
 *       type: sqlite
 *       path: ./cache.db
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@ConfigurationProperties(prefix = "industrydb")
public class ConnectionsProperties {

    /**
     * Connection sections keyed by logical name.
     */
    private Map<String, Entry> connections = new LinkedHashMap<>();

    /**
     * Converts and validates every section.
     *
     * @return validated descriptors keyed by section name, in declaration order
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} naming the first invalid
     *         section
     */
    public Map<String, ConnectionDescriptor> toDescriptors() throws IndustryDbException {
        Map<String, ConnectionDescriptor> result = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> section : connections.entrySet()) {
            result.put(section.getKey(), convert(section.getKey(), section.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns the validated descriptor of one section.
     *
     * @param name section name
     * @return validated descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if the section is unknown or
     *         invalid
     */
    public ConnectionDescriptor descriptor(String name) throws IndustryDbException {
        Entry entry = connections.get(name);
        if (entry == null) {
            throw IndustryDbException.configuration("Unknown connection '" + name + "'");
        }
        return convert(name, entry);
    }

    private static ConnectionDescriptor convert(String name, Entry entry)
            throws IndustryDbException {
        if (entry == null || entry.getType() == null) {
            throw IndustryDbException
                    .configuration("Connection '" + name + "' missing 'type' field");
        }
        try {
            return entry.toDescriptor();
        } catch (IndustryDbException e) {
            throw new IndustryDbException(e.getKind(),
                    "Invalid connection '" + name + "': " + e.getDetail(), e);
        }
    }

    /**
     * One connection section.
     */
    @Data
    public static class Entry {
        // postgres / postgresql / mssql / sqlserver / sqlite
        private String type;
        private String host;
        // SQL Server style alias of host
        private String server;
        private Integer port;
        private String database;
        private String username;
        @ToString.Exclude
        private String password;
        // SQLite file path or :memory:
        private String path;
        private Boolean integratedAuth;
        // SQL Server style alias of integrated-auth
        private Boolean trustedConnection;
        // Seconds
        private Integer timeout;
        // Backend specific tuning passed through as descriptor extensions
        private Map<String, String> options = new LinkedHashMap<>();

        /**
         * Converts this section into a validated descriptor.
         *
         * @return validated descriptor
         * @throws IndustryDbException if the type is unknown or validation fails
         */
        public ConnectionDescriptor toDescriptor() throws IndustryDbException {
            return ConnectionDescriptor.builder()
                    .type(DatabaseType.fromName(type))
                    .host(host != null ? host : server)
                    .port(port)
                    .database(database)
                    .username(username)
                    .password(password)
                    .path(path)
                    .integratedAuth(integratedAuth != null ? integratedAuth : trustedConnection)
                    .timeoutSeconds(timeout)
                    .extensions(options == null ? Collections.emptyMap() : options)
                    .buildValidated();
        }
    }
}
