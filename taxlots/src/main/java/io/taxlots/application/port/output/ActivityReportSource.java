package io.taxlots.application.port.output;

import io.taxlots.domain.report.TaxInput;

/**
 * Output Port: Broker activity records.
 *
 * Implementations read broker exports and hand back validated, chronologically
 * ordered trades, dividends and withholdings.
 */
public interface ActivityReportSource {

    /**
     * @throws io.taxlots.domain.common.InvalidRecordException if any record is malformed
     * @throws java.io.UncheckedIOException if the source cannot be read
     */
    TaxInput load();
}
