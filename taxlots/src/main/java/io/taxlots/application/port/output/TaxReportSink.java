package io.taxlots.application.port.output;

import io.taxlots.domain.report.TaxReport;

/**
 * Output Port: Destination for a computed report.
 */
public interface TaxReportSink {

    void write(TaxReport report);
}
