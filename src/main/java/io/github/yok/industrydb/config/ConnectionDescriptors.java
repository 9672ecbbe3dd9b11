package io.github.yok.industrydb.config;

import io.github.yok.industrydb.error.IndustryDbException;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Validation rules for {@link ConnectionDescriptor}.
 *
 * <p>
 * Rules are evaluated in the following order and the first failure wins:
 * </p>
 * <ol>
 * <li>Type specific required fields, and network address vs. file path exclusivity.</li>
 * <li>Range of {@code port} (1-65535) and {@code timeoutSeconds} (0 or more) when present.</li>
 * <li>Integrated authentication and explicit credentials must not both be set.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ConnectionDescriptors {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ConnectionDescriptors() {}

    /**
     * Validates a descriptor.
     *
     * @param descriptor descriptor to validate
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} describing the first failure
     */
    public static void validate(ConnectionDescriptor descriptor) throws IndustryDbException {
        if (descriptor == null) {
            throw IndustryDbException.configuration("Missing connection descriptor");
        }
        DatabaseType type = descriptor.getType();
        if (type == null) {
            throw IndustryDbException.configuration("Missing database type");
        }
        checkRequiredFields(type, descriptor);
        checkRanges(descriptor);
        checkAuthenticationExclusivity(type, descriptor);
    }

    /**
     * Returns whether a descriptor passes {@link #validate}.
     *
     * @param descriptor descriptor
     * @return {@code true} when valid
     */
    public static boolean isValid(ConnectionDescriptor descriptor) {
        try {
            validate(descriptor);
            return true;
        } catch (IndustryDbException e) {
            return false;
        }
    }

    private static void checkRequiredFields(DatabaseType type, ConnectionDescriptor descriptor)
            throws IndustryDbException {
        String label = label(type);
        if (type == DatabaseType.SQLITE) {
            if (StringUtils.isBlank(descriptor.getPath())) {
                throw IndustryDbException.configuration("Missing path for " + label);
            }
            if (descriptor.getHost() != null || descriptor.getPort() != null) {
                throw IndustryDbException
                        .configuration("Network address must not be set for " + label);
            }
            if (descriptor.getDatabase() != null || descriptor.getUsername() != null
                    || descriptor.getPassword() != null || descriptor.getIntegratedAuth() != null) {
                throw IndustryDbException.configuration(
                        "Database name and credentials are not applicable to " + label);
            }
            return;
        }

        if (StringUtils.isBlank(descriptor.getHost())) {
            String field = type == DatabaseType.MSSQL ? "server" : "host";
            throw IndustryDbException.configuration("Missing " + field + " for " + label);
        }
        if (StringUtils.isBlank(descriptor.getDatabase())) {
            throw IndustryDbException.configuration("Missing database for " + label);
        }
        if (descriptor.getPath() != null) {
            throw IndustryDbException.configuration("File path must not be set for " + label);
        }
        boolean hasUsername = StringUtils.isNotBlank(descriptor.getUsername());
        if (!hasUsername && descriptor.getPassword() != null) {
            throw IndustryDbException.configuration("Password given without username for " + label);
        }
        if (!hasUsername && !descriptor.usesIntegratedAuth()) {
            throw IndustryDbException.configuration(
                    "Missing username (or integrated authentication) for " + label);
        }
    }

    private static void checkRanges(ConnectionDescriptor descriptor) throws IndustryDbException {
        Integer port = descriptor.getPort();
        if (port != null && (port < 1 || port > 65535)) {
            throw IndustryDbException.configuration("Port out of range (1-65535): " + port);
        }
        Integer timeout = descriptor.getTimeoutSeconds();
        if (timeout != null && timeout < 0) {
            throw IndustryDbException.configuration("Timeout must not be negative: " + timeout);
        }
    }

    private static void checkAuthenticationExclusivity(DatabaseType type,
            ConnectionDescriptor descriptor) throws IndustryDbException {
        if (!descriptor.usesIntegratedAuth()) {
            return;
        }
        if (descriptor.getUsername() != null || descriptor.getPassword() != null) {
            throw IndustryDbException.configuration(
                    "Integrated authentication and explicit credentials are mutually exclusive for "
                            + label(type));
        }
    }

    private static String label(DatabaseType type) {
        if (type == DatabaseType.POSTGRES) {
            return "Postgres";
        }
        if (type == DatabaseType.MSSQL) {
            return "MSSQL";
        }
        return "SQLite";
    }
}
