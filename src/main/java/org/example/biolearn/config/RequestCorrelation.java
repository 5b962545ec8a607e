package org.example.biolearn.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request id shared by the {@code X-Request-Id} header, the request attribute and the logging MDC.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";

    static final int MAX_LENGTH = 80;
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        if (request.getAttribute(ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    /**
     * The id a request runs under: the client's own when it is safe to echo, a fresh UUID otherwise.
     */
    static String fromHeaderOrNew(String headerValue) {
        String clientId = sanitize(headerValue);
        return clientId != null ? clientId : UUID.randomUUID().toString();
    }

    /**
     * Returns a client-supplied id fit for echoing back, or {@code null} when it should be replaced.
     */
    static String sanitize(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        String trimmed = headerValue.trim();
        if (trimmed.length() > MAX_LENGTH) {
            trimmed = trimmed.substring(0, MAX_LENGTH);
        }
        if (trimmed.isEmpty() || !SAFE_ID.matcher(trimmed).matches()) {
            return null;
        }
        return trimmed;
    }
}
