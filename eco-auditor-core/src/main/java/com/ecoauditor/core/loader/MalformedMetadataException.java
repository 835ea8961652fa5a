package com.ecoauditor.core.loader;

/**
 * Thrown when ecosystem metadata cannot be parsed at all.
 *
 * <p>This is the only fatal error of an audit run: the input is not a well-formed
 * document, or its structure is so broken that no record can be read. Every other
 * anomaly is reported as a finding.
 */
public class MalformedMetadataException extends RuntimeException {

    private final String source;
    private final String record;
    private final String reason;

    /**
     * Creates a new exception.
     *
     * @param source file or input the problem was found in
     * @param record offending record (name or {@code #position}), or null when not record-specific
     * @param reason what is wrong
     * @param cause underlying parse error, may be null
     */
    public MalformedMetadataException(String source, String record, String reason, Throwable cause) {
        super(format(source, record, reason), cause);
        this.source = source;
        this.record = record;
        this.reason = reason;
    }

    public MalformedMetadataException(String source, String record, String reason) {
        this(source, record, reason, null);
    }

    public String getSource() {
        return source;
    }

    public String getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    private static String format(String source, String record, String reason) {
        StringBuilder message = new StringBuilder("Malformed metadata in ").append(source);
        if (record != null) {
            message.append(" (record ").append(record).append(')');
        }
        return message.append(": ").append(reason).toString();
    }
}
