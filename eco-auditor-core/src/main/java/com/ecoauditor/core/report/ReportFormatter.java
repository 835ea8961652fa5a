package com.ecoauditor.core.report;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Serializes an {@link AuditReport} into a text format.
 *
 * <p>Formatters are discovered via Java Service Provider Interface (SPI). Output must be a
 * pure function of the report: no timestamps or host details, so identical reports give
 * byte-identical output.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ecoauditor.core.report.ReportFormatter}
 */
public interface ReportFormatter {

    /**
     * Returns unique identifier for this formatter, as used by {@code --format}
     * (e.g., "text", "json").
     *
     * @return formatter identifier
     */
    String getId();

    /**
     * Returns file extension for formatted reports, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Formats the report.
     *
     * @param report audit report
     * @return formatted report
     */
    String format(AuditReport report);

    /**
     * Finds a formatter by id.
     *
     * @param id formatter id
     * @return formatter, or empty when none is registered under that id
     */
    static Optional<ReportFormatter> find(String id) {
        for (ReportFormatter formatter : ServiceLoader.load(ReportFormatter.class)) {
            if (formatter.getId().equalsIgnoreCase(id)) {
                return Optional.of(formatter);
            }
        }
        return Optional.empty();
    }
}
