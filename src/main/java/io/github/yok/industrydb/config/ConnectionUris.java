package io.github.yok.industrydb.config;

import io.github.yok.industrydb.error.IndustryDbException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts {@link ConnectionDescriptor} to and from a URI string.
 *
 * <p>
 * Formats:
 * </p>
 * <ul>
 * <li>PostgreSQL:
 * {@code postgresql://[user[:password]@]host[:port]/database[?integrated_auth=true&timeout=30]}</li>
 * <li>SQL Server:
 * {@code mssql://[user[:password]@]host[:port]/?database=db[&trusted_connection=true][&timeout=30]}</li>
 * <li>SQLite: {@code sqlite://path[?timeout=30]}</li>
 * </ul>
 *
 * <p>
 * Every component is percent-encoded, so {@code fromUri(toUri(d))} reproduces {@code d} for every
 * valid descriptor whose extension map is empty. Extension entries are never written by
 * {@link #toUri}; unknown query parameters read by {@link #fromUri} are collected into the
 * extension map. Extension entries therefore do not round-trip.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ConnectionUris {

    private static final String SEPARATOR = "://";
    private static final String PARAM_DATABASE = "database";
    private static final String PARAM_INTEGRATED_AUTH = "integrated_auth";
    private static final String PARAM_TRUSTED_CONNECTION = "trusted_connection";
    private static final String PARAM_TIMEOUT = "timeout";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ConnectionUris() {}

    /**
     * Renders a descriptor as a URI.
     *
     * @param descriptor descriptor to render
     * @return URI string
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if the descriptor is invalid
     */
    public static String toUri(ConnectionDescriptor descriptor) throws IndustryDbException {
        ConnectionDescriptors.validate(descriptor);
        DatabaseType type = descriptor.getType();
        Map<String, String> params = new LinkedHashMap<>();
        StringBuilder uri = new StringBuilder();

        if (type == DatabaseType.SQLITE) {
            uri.append("sqlite").append(SEPARATOR).append(encodePath(descriptor.getPath()));
        } else {
            uri.append(type == DatabaseType.POSTGRES ? "postgresql" : "mssql").append(SEPARATOR);
            appendAuthority(uri, descriptor);
            uri.append('/');
            if (type == DatabaseType.POSTGRES) {
                uri.append(encode(descriptor.getDatabase()));
            } else {
                params.put(PARAM_DATABASE, descriptor.getDatabase());
            }
            if (descriptor.getIntegratedAuth() != null) {
                String key = type == DatabaseType.POSTGRES ? PARAM_INTEGRATED_AUTH
                        : PARAM_TRUSTED_CONNECTION;
                params.put(key, descriptor.getIntegratedAuth().toString());
            }
        }
        if (descriptor.getTimeoutSeconds() != null) {
            params.put(PARAM_TIMEOUT, descriptor.getTimeoutSeconds().toString());
        }
        appendQuery(uri, params);
        return uri.toString();
    }

    /**
     * Parses a URI into a validated descriptor.
     *
     * <p>
     * Accepted schemes: {@code postgresql}, {@code postgres}, {@code mssql}, {@code sqlserver},
     * {@code sqlite}.
     * </p>
     *
     * @param uri URI text
     * @return validated descriptor
     * @throws IndustryDbException with {@code CONFIGURATION_INVALID} if the text cannot be parsed
     *         or the parsed descriptor is invalid
     */
    public static ConnectionDescriptor fromUri(String uri) throws IndustryDbException {
        if (StringUtils.isBlank(uri)) {
            throw IndustryDbException.configuration("Empty connection URI");
        }
        int schemeEnd = uri.indexOf(SEPARATOR);
        if (schemeEnd <= 0) {
            throw IndustryDbException.configuration("Unsupported URI scheme: " + uri);
        }
        String scheme = uri.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        String rest = uri.substring(schemeEnd + SEPARATOR.length());

        ConnectionDescriptor descriptor;
        if ("postgresql".equals(scheme) || "postgres".equals(scheme)) {
            descriptor = parseServer(DatabaseType.POSTGRES, rest);
        } else if ("mssql".equals(scheme) || "sqlserver".equals(scheme)) {
            descriptor = parseServer(DatabaseType.MSSQL, rest);
        } else if ("sqlite".equals(scheme)) {
            descriptor = parseSqlite(rest);
        } else {
            throw IndustryDbException.configuration("Unsupported URI scheme: " + scheme);
        }
        ConnectionDescriptors.validate(descriptor);
        return descriptor;
    }

    private static ConnectionDescriptor parseServer(DatabaseType type, String rest)
            throws IndustryDbException {
        String query = null;
        int q = rest.indexOf('?');
        if (q >= 0) {
            query = rest.substring(q + 1);
            rest = rest.substring(0, q);
        }
        int slash = rest.indexOf('/');
        String authority = slash < 0 ? rest : rest.substring(0, slash);
        String pathPart = slash < 0 ? "" : rest.substring(slash + 1);

        ConnectionDescriptor.ConnectionDescriptorBuilder builder =
                ConnectionDescriptor.builder().type(type);

        String hostPort = authority;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            String userInfo = authority.substring(0, at);
            hostPort = authority.substring(at + 1);
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                builder.username(decode(userInfo));
            } else {
                builder.username(decode(userInfo.substring(0, colon)));
                builder.password(decode(userInfo.substring(colon + 1)));
            }
        }
        int portSeparator = hostPort.lastIndexOf(':');
        String host = hostPort;
        if (portSeparator >= 0) {
            host = hostPort.substring(0, portSeparator);
            builder.port(parseInteger("port", hostPort.substring(portSeparator + 1)));
        }
        if (!host.isEmpty()) {
            builder.host(decode(host));
        }

        Map<String, String> params = parseQuery(query);
        String database = params.remove(PARAM_DATABASE);
        if (database == null && !pathPart.isEmpty()) {
            database = decode(pathPart);
        }
        builder.database(database);

        String integrated = params.remove(PARAM_INTEGRATED_AUTH);
        String trusted = params.remove(PARAM_TRUSTED_CONNECTION);
        String flag = integrated != null ? integrated : trusted;
        if (flag != null) {
            builder.integratedAuth(parseBoolean(flag));
        }
        applyCommonParams(builder, params);
        return builder.build();
    }

    private static ConnectionDescriptor parseSqlite(String rest) throws IndustryDbException {
        String query = null;
        int q = rest.indexOf('?');
        if (q >= 0) {
            query = rest.substring(q + 1);
            rest = rest.substring(0, q);
        }
        ConnectionDescriptor.ConnectionDescriptorBuilder builder =
                ConnectionDescriptor.builder().type(DatabaseType.SQLITE);
        if (!rest.isEmpty()) {
            builder.path(decode(rest));
        }
        applyCommonParams(builder, parseQuery(query));
        return builder.build();
    }

    private static void applyCommonParams(ConnectionDescriptor.ConnectionDescriptorBuilder builder,
            Map<String, String> params) throws IndustryDbException {
        String timeout = params.remove(PARAM_TIMEOUT);
        if (timeout != null) {
            builder.timeoutSeconds(parseInteger(PARAM_TIMEOUT, timeout));
        }
        builder.extensions(params);
    }

    private static void appendAuthority(StringBuilder uri, ConnectionDescriptor descriptor) {
        if (descriptor.getUsername() != null) {
            uri.append(encode(descriptor.getUsername()));
            if (descriptor.getPassword() != null) {
                uri.append(':').append(encode(descriptor.getPassword()));
            }
            uri.append('@');
        }
        uri.append(encode(descriptor.getHost()));
        if (descriptor.getPort() != null) {
            uri.append(':').append(descriptor.getPort());
        }
    }

    private static void appendQuery(StringBuilder uri, Map<String, String> params) {
        char separator = '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            uri.append(separator).append(param.getKey()).append('=')
                    .append(encode(param.getValue()));
            separator = '&';
        }
    }

    private static Map<String, String> parseQuery(String query) throws IndustryDbException {
        Map<String, String> params = new LinkedHashMap<>();
        if (StringUtils.isEmpty(query)) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.put(key.toLowerCase(Locale.ROOT), value);
        }
        return params;
    }

    private static Integer parseInteger(String name, String text) throws IndustryDbException {
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw IndustryDbException.configuration("Invalid " + name + " in URI: " + text);
        }
    }

    private static Boolean parseBoolean(String text) throws IndustryDbException {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized) || "yes".equals(normalized) || "1".equals(normalized)) {
            return Boolean.TRUE;
        }
        if ("false".equals(normalized) || "no".equals(normalized) || "0".equals(normalized)) {
            return Boolean.FALSE;
        }
        throw IndustryDbException.configuration("Invalid boolean in URI: " + text);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodePath(String path) {
        return encode(path).replace("%2F", "/").replace("%3A", ":");
    }

    private static String decode(String value) throws IndustryDbException {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw IndustryDbException.configuration("Malformed escape in URI component: " + value);
        }
    }
}
