// file: server/src/main/java/io/objledger/server/RequestLogger.java
package io.objledger.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP API: method, path, status and latency.
 * Rejected requests (4xx) log at FINE, server errors at WARNING with the cause.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method          HTTP method
     * @param path            request path
     * @param status          HTTP status code
     * @param totalMillis     wall-clock latency for the whole request
     * @param executionMillis time spent in the authority state, or -1 if not measured
     * @param error           exception behind an error status, or null
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long executionMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                executionMillis >= 0 ? ", execution=" + executionMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 400) {
            log.log(Level.FINE, error == null ? msg : msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
