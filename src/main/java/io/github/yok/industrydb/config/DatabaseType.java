package io.github.yok.industrydb.config;

import io.github.yok.industrydb.error.IndustryDbException;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Backend tag of a {@link ConnectionDescriptor}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum DatabaseType {

    /**
     * PostgreSQL server.
     */
    POSTGRES("postgres"),

    /**
     * Microsoft SQL Server.
     */
    MSSQL("mssql"),

    /**
     * Embedded single-file SQLite engine.
     */
    SQLITE("sqlite");

    // Lower-case name used in URIs, configuration files and log output
    private final String id;

    /**
     * Resolves a type from its textual name.
     *
     * <p>
     * Accepted names (case-insensitive): {@code postgres}, {@code postgresql}, {@code mssql},
     * {@code sqlserver}, {@code sqlite}.
     * </p>
     *
     * @param name type name
     * @return resolved type
     * @throws IndustryDbException with {@code UNSUPPORTED_BACKEND} if the name is unknown
     */
    public static DatabaseType fromName(String name) throws IndustryDbException {
        if (name == null) {
            throw IndustryDbException.unsupportedBackend("null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("postgres".equals(normalized) || "postgresql".equals(normalized)) {
            return POSTGRES;
        }
        if ("mssql".equals(normalized) || "sqlserver".equals(normalized)) {
            return MSSQL;
        }
        if ("sqlite".equals(normalized)) {
            return SQLITE;
        }
        throw IndustryDbException.unsupportedBackend(name);
    }

    /**
     * Returns whether this backend is reached over the network.
     *
     * @return {@code true} for server based backends
     */
    public boolean isNetworked() {
        return this != SQLITE;
    }

    @Override
    public String toString() {
        return id;
    }
}
