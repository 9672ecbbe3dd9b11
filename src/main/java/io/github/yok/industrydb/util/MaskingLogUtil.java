package io.github.yok.industrydb.util;

import io.github.yok.industrydb.config.ConnectionDescriptor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking sensitive values in connector logs.
 *
 * <p>
 * Connection details are logged when a pool opens and closes. Passwords never reach the log: they
 * are masked in descriptors, in credentials embedded in URLs and in {@code password=} parameters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches {@code user:password@} in authority-style URLs.
     */
    private static final Pattern URL_AUTH_PATTERN =
            Pattern.compile("(^[a-z][a-z0-9+.:-]*://[^:/?#@]+:)([^@/]*)(@.*)",
                    Pattern.CASE_INSENSITIVE);
    /**
     * Pattern that matches password parameters in JDBC URLs and property strings.
     */
    private static final Pattern PASSWORD_PARAM_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password fragments in a connection URL.
     *
     * @param url JDBC URL or connection URI
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = URL_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        Matcher paramMatcher = PASSWORD_PARAM_PATTERN.matcher(masked);
        if (paramMatcher.find()) {
            masked = paramMatcher.replaceAll("$1***");
        }
        return masked;
    }

    /**
     * Formats a descriptor for logging with masked sensitive values.
     *
     * @param descriptor connection descriptor
     * @return formatted log string
     */
    public static String maskDescriptor(ConnectionDescriptor descriptor) {
        if (descriptor == null) {
            return "<null>";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("type=").append(descriptor.getType());
        if (descriptor.getType() != null && descriptor.getType().isNetworked()) {
            builder.append(", host=").append(descriptor.getHost());
            if (descriptor.getPort() != null) {
                builder.append(", port=").append(descriptor.getPort());
            }
            builder.append(", database=").append(descriptor.getDatabase());
            builder.append(", user=").append(descriptor.getUsername());
            builder.append(", password=").append(maskText(descriptor.getPassword()));
            builder.append(", integratedAuth=").append(descriptor.usesIntegratedAuth());
        } else {
            builder.append(", path=").append(descriptor.getPath());
        }
        if (descriptor.getTimeoutSeconds() != null) {
            builder.append(", timeout=").append(descriptor.getTimeoutSeconds()).append('s');
        }
        return builder.toString();
    }
}
