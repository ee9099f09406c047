package io.amqpmesh.support;

import java.util.regex.Pattern;

/**
 * Strips credentials from broker URLs before they reach a log line.
 */
public final class Redaction {

    public static final String PASSWORD_PLACEHOLDER = "***";

    private static final Pattern URL_PASSWORD = Pattern.compile("(amqps?://)([^:/@]+):([^@]+)@");

    private Redaction() {
    }

    public static String redactPassword(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return URL_PASSWORD.matcher(value).replaceAll("$1$2:" + PASSWORD_PLACEHOLDER + "@");
    }
}
