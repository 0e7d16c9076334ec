package com.uptime.keeper.monitor.util;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import javax.net.ssl.SSLException;

/**
 * Maps transport exceptions to the short detail codes carried by probe results and
 * failed redeploy attempts.
 */
public final class FailureClassifier {
    public static final String TIMEOUT = "timeout";
    public static final String CONNECT_TIMEOUT = "connect_timeout";
    public static final String DNS_FAILURE = "dns_failure";
    public static final String CONNECTION_REFUSED = "connection_refused";
    public static final String NO_ROUTE = "no_route_to_host";
    public static final String TLS_FAILURE = "tls_failure";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String IO_ERROR = "io_error";

    private FailureClassifier() {}

    public static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    public static String classify(Throwable error) {
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof HttpConnectTimeoutException) {
                return CONNECT_TIMEOUT;
            }
            if (current instanceof HttpTimeoutException) {
                return TIMEOUT;
            }
            if (current instanceof UnknownHostException) {
                return DNS_FAILURE;
            }
            if (current instanceof NoRouteToHostException) {
                return NO_ROUTE;
            }
            if (current instanceof ConnectException) {
                return CONNECTION_REFUSED;
            }
            if (current instanceof SSLException) {
                return TLS_FAILURE;
            }
            if (current instanceof InterruptedException) {
                return INTERRUPTED;
            }
            if (current instanceof IllegalArgumentException) {
                return INVALID_URL;
            }
        }
        for (Throwable current = error; current != null; current = next(current)) {
            String lower = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (lower.contains("name or service not known") || lower.contains("no such host")) {
                return DNS_FAILURE;
            }
            if (lower.contains("connection refused")) {
                return CONNECTION_REFUSED;
            }
            if (lower.contains("ssl") || lower.contains("handshake")) {
                return TLS_FAILURE;
            }
        }
        return IO_ERROR;
    }

    private static Throwable next(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
