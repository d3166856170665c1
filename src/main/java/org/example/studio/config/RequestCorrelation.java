package org.example.studio.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";
    static final int MAX_LENGTH = 80;

    // ids are echoed into every log line
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._:-]");

    private RequestCorrelation() {
    }

    /**
     * Normalize a client-supplied request id. Unsafe characters become {@code _} and the id is
     * capped at {@value #MAX_LENGTH} characters; blank ids are rejected.
     */
    public static Optional<String> sanitize(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        String trimmed = headerValue.trim();
        if (trimmed.length() > MAX_LENGTH) {
            trimmed = trimmed.substring(0, MAX_LENGTH);
        }
        return Optional.of(UNSAFE_CHARS.matcher(trimmed).replaceAll("_"));
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        Object requestId = request.getAttribute(ATTRIBUTE_NAME);
        if (requestId instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    /**
     * Wrap a task so that it logs under the request id of the thread that submitted it.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    /**
     * Executor view that runs every task under the submitting thread's request id.
     */
    public static Executor wrap(Executor delegate) {
        return task -> delegate.execute(propagate(task));
    }
}
