package com.sharedsource.webapi.data;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.validator.routines.InetAddressValidator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Host name normalization for data contexts.
 *
 * <p>Accepts a host with or without {@code http://} or {@code https://} prefix, trailing slashes
 * <br>and an optional port, and returns it with exactly one scheme prefix and no trailing slash.
 * <br>An explicit {@code https://} prefix makes the host secure regardless of the secure flag.
 */
final class HostNames {

    static final String HTTP = "http://";
    static final String HTTPS = "https://";

    private static final Pattern HOST_PORT = Pattern.compile("^(\\[[^\\]\\s]+\\]|[^:/\\[\\]\\s]+)(?::(\\d{1,5}))?$");
    private static final Pattern DNS_NAME = Pattern.compile(
            "^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");

    /**
     * Private constructor.
     */
    private HostNames() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalizes a host name.
     *
     * @param hostName Host name.
     * @param secure   Use https.
     * @return Scheme prefixed host name.
     * @throws IllegalArgumentException If the host name is not recognized.
     */
    static String normalize(String hostName, boolean secure) {
        if (StringUtils.isBlank(hostName)) {
            throw new IllegalArgumentException("hostName cannot be null, empty or an un-recognized type");
        }

        String trimmed = hostName.trim();
        boolean https = StringUtils.startsWithIgnoreCase(trimmed, HTTPS);
        String bare = StringUtils.removeStartIgnoreCase(StringUtils.removeStartIgnoreCase(trimmed, HTTPS), HTTP);
        bare = StringUtils.stripEnd(bare, "/");

        if (!isValid(bare)) {
            throw new IllegalArgumentException("hostName cannot be null, empty or an un-recognized type: " + hostName);
        }

        return (secure || https ? HTTPS : HTTP) + bare;
    }

    /**
     * Checks if a normalized host name uses https.
     *
     * @param hostName Normalized host name.
     * @return Boolean.
     */
    static boolean isSecure(String hostName) {
        return StringUtils.startsWithIgnoreCase(hostName, HTTPS);
    }

    /**
     * Validates a host name without scheme.
     *
     * @param bare Host with optional port.
     * @return Boolean.
     */
    static boolean isValid(String bare) {
        Matcher matcher = HOST_PORT.matcher(bare);
        if (!matcher.matches()) {
            return false;
        }

        String port = matcher.group(2);
        if (port != null) {
            int value = Integer.parseInt(port);
            if (value < 1 || value > 65535) {
                return false;
            }
        }

        String host = matcher.group(1);
        InetAddressValidator validator = InetAddressValidator.getInstance();
        if (host.startsWith("[")) {
            return validator.isValidInet6Address(host.substring(1, host.length() - 1));
        }

        return validator.isValidInet4Address(host) || DNS_NAME.matcher(host).matches();
    }
}
