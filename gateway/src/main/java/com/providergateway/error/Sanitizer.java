package com.providergateway.error;

import java.util.regex.Pattern;

/**
 * Masks credential-looking fragments before text reaches logs, probe snapshots
 * or error detail.
 */
public final class Sanitizer {

    private static final int DEFAULT_MAX_LENGTH = 2048;

    private static final Pattern FLAG_SECRETS = Pattern.compile(
            "(--?(?:api[_-]?key|token|password|secret))([=\\s]+)\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEARER = Pattern.compile(
            "(Bearer\\s+)[A-Za-z0-9._~+/=-]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_SECRETS = Pattern.compile(
            "(\"(?:api[_-]?key|access_token|client_secret|password|secret|token)\"\\s*:\\s*\")[^\"]*(\")",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUERY_KEY = Pattern.compile(
            "([?&](?:key|api_key|token)=)[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private Sanitizer() {
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = FLAG_SECRETS.matcher(text).replaceAll("$1=***");
        result = BEARER.matcher(result).replaceAll("$1***");
        result = JSON_SECRETS.matcher(result).replaceAll("$1***$2");
        return QUERY_KEY.matcher(result).replaceAll("$1***");
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...(" + (text.length() - maxLength) + " more chars)";
    }

    /**
     * Redacted and truncated, suitable for snapshots and operator detail.
     */
    public static String snapshot(String text) {
        return truncate(redact(text), DEFAULT_MAX_LENGTH);
    }
}
