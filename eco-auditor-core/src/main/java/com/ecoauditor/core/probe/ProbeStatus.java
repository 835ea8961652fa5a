package com.ecoauditor.core.probe;

/**
 * Kind of result a link probe produced.
 */
public enum ProbeStatus {
    /** The server answered; see the status code. */
    RESPONDED,
    /** No answer within the per-request timeout, or the probe budget ran out first. */
    TIMEOUT,
    /** Connection refused, reset, DNS failure or TLS error. */
    CONNECTION_ERROR,
    /** Not an absolute http(s) URL. */
    MALFORMED_URL
}
