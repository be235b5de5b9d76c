package com.flagship.pharmacy_pos.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys shared by the request filter and the terminal facades.
 *
 * The correlation id lives in the MDC for the whole request; cashiers quote
 * it from the error screen, so generated ids are kept short.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TERMINAL_ID_MDC_KEY = "terminalId";
    public static final String USER_ID_MDC_KEY = "userId";

    // anything else from a client header could forge log lines
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * The caller's id when it is well formed, otherwise a fresh one.
     */
    static String resolve(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Null outside an HTTP request.
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void bindOperation(Object terminalId, Object userId) {
        MDC.put(TERMINAL_ID_MDC_KEY, String.valueOf(terminalId));
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId.toString());
        }
    }

    public static void clearOperation() {
        MDC.remove(TERMINAL_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }
}
