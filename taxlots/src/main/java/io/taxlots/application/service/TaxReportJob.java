package io.taxlots.application.service;

import io.taxlots.application.port.output.ActivityReportSource;
import io.taxlots.application.port.output.RateSampleSource;
import io.taxlots.application.port.output.TaxReportSink;
import io.taxlots.domain.fx.RateSample;
import io.taxlots.domain.report.TaxInput;
import io.taxlots.domain.report.TaxReport;
import io.taxlots.service.fx.ExchangeRateTable;
import io.taxlots.service.report.TaxReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One batch run: load activity and rates, compute, hand the report to the sink.
 *
 * The rate table is built once here and shared by every valuation of the run.
 */
public final class TaxReportJob {
    private static final Logger log = LoggerFactory.getLogger(TaxReportJob.class);

    private final ActivityReportSource activitySource;
    private final RateSampleSource rateSource;
    private final TaxReportService reportService;
    private final TaxReportSink sink;

    public TaxReportJob(ActivityReportSource activitySource,
                        RateSampleSource rateSource,
                        TaxReportService reportService,
                        TaxReportSink sink) {
        this.activitySource = activitySource;
        this.rateSource = rateSource;
        this.reportService = reportService;
        this.sink = sink;
    }

    public TaxReport run() {
        long start = System.currentTimeMillis();

        List<RateSample> samples = rateSource.load();
        ExchangeRateTable rates = ExchangeRateTable.build(samples);

        TaxInput input = activitySource.load();
        TaxReport report = reportService.compute(input, rates);

        sink.write(report);

        log.info("[TaxReportJob] Completed in {}ms", System.currentTimeMillis() - start);
        return report;
    }
}
