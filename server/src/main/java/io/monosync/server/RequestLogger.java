// file: server/src/main/java/io/monosync/server/RequestLogger.java
package io.monosync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request access log.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Separate the engine's share of the latency from HTTP overhead.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method       HTTP method (GET, POST, PUT, DELETE)
     * @param path         request path
     * @param status       HTTP status code
     * @param totalMillis  wall-clock latency for the whole request
     * @param engineMillis time spent in the sync engine, or -1 if not measured
     * @param error        exception behind a failed request, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                engineMillis >= 0 ? ", engine=" + engineMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
