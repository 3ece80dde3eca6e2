package io.taxlots.bootstrap;

import io.taxlots.domain.trade.SplitAdjustment;
import io.taxlots.util.Env;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch run settings, read once at startup.
 */
public record AppConfig(
        Path reportsDir,
        Path rateFeed,
        Path output,
        String tradeCurrency,
        List<SplitAdjustment> splits,
        int matchParallelism) {

    public AppConfig {
        splits = List.copyOf(splits);
    }

    public static AppConfig fromEnv() {
        return new AppConfig(
                Env.getPath("TAXLOTS_REPORTS_DIR", "ib_reports"),
                Env.getPath("TAXLOTS_RATE_FEED", "data/usd_rub.dat"),
                Env.getPath("TAXLOTS_OUTPUT", "tax-report.json"),
                Env.get("TAXLOTS_TRADE_CURRENCY", "USD"),
                Env.getList("TAXLOTS_SPLITS").stream().map(SplitAdjustment::parse).toList(),
                Env.getInt("TAXLOTS_MATCH_PARALLELISM", 1));
    }
}
