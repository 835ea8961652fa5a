package com.ecoauditor.core.probe;

import java.util.Objects;

/**
 * Result of probing one URL.
 *
 * @param url probed URL
 * @param status kind of result
 * @param statusCode HTTP status code when {@code status} is {@link ProbeStatus#RESPONDED}, otherwise null
 * @param attempts number of requests issued
 * @param retriesExhausted true when the last attempt was still a transient failure
 * @param detail error detail, may be null
 */
public record ProbeOutcome(
    String url,
    ProbeStatus status,
    Integer statusCode,
    int attempts,
    boolean retriesExhausted,
    String detail
) {
    public ProbeOutcome {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == ProbeStatus.RESPONDED && statusCode == null) {
            throw new IllegalArgumentException("statusCode required for RESPONDED outcomes");
        }
    }

    public static ProbeOutcome responded(String url, int statusCode, int attempts) {
        return new ProbeOutcome(url, ProbeStatus.RESPONDED, statusCode, attempts, false, null);
    }

    public static ProbeOutcome timeout(String url, int attempts, String detail) {
        return new ProbeOutcome(url, ProbeStatus.TIMEOUT, null, attempts, false, detail);
    }

    public static ProbeOutcome connectionError(String url, int attempts, String detail) {
        return new ProbeOutcome(url, ProbeStatus.CONNECTION_ERROR, null, attempts, false, detail);
    }

    public static ProbeOutcome malformed(String url, String detail) {
        return new ProbeOutcome(url, ProbeStatus.MALFORMED_URL, null, 0, false, detail);
    }

    /**
     * Returns true for 2xx and 3xx answers.
     *
     * @return whether the link is alive
     */
    public boolean isReachable() {
        return status == ProbeStatus.RESPONDED && statusCode >= 200 && statusCode < 400;
    }

    /**
     * Returns true for failures worth retrying: connection errors and 5xx answers.
     *
     * @return whether another attempt may succeed
     */
    public boolean isTransient() {
        return status == ProbeStatus.CONNECTION_ERROR
            || (status == ProbeStatus.RESPONDED && statusCode >= 500);
    }

    ProbeOutcome exhausted() {
        return new ProbeOutcome(url, status, statusCode, attempts, true, detail);
    }

    /**
     * Short human-readable description, e.g. {@code "HTTP 500 (failed after 3 attempts)"}.
     *
     * @return description
     */
    public String describe() {
        String base = switch (status) {
            case RESPONDED -> "HTTP " + statusCode;
            case TIMEOUT -> "timeout";
            case CONNECTION_ERROR -> "connection error";
            case MALFORMED_URL -> "malformed URL";
        };
        if (detail != null && status != ProbeStatus.RESPONDED) {
            base += ": " + detail;
        }
        if (retriesExhausted) {
            base += " (failed after " + attempts + " attempts)";
        }
        return base;
    }
}
