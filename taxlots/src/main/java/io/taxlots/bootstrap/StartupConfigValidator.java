package io.taxlots.bootstrap;

import io.taxlots.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Startup configuration validator.
 *
 * Runs before any input is read. Throws IllegalStateException if the configuration
 * cannot produce a report, so a run never starts half-configured.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final int MAX_PARALLELISM = 64;

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(AppConfig config, InputValidator validator) {
        log.info("Running startup config validation...");

        if (!Files.isDirectory(config.reportsDir())) {
            throw new IllegalStateException(
                "INVALID CONFIG: reports directory not found: " + config.reportsDir().toAbsolutePath() + "\n" +
                "Set TAXLOTS_REPORTS_DIR to the directory holding the IB activity statements (*.csv)");
        }
        log.info("✓ Reports directory: {}", config.reportsDir());

        if (!Files.isRegularFile(config.rateFeed())) {
            throw new IllegalStateException(
                "INVALID CONFIG: rate feed not found: " + config.rateFeed().toAbsolutePath() + "\n" +
                "Set TAXLOTS_RATE_FEED to the daily rate file (dd.MM.yyyy<TAB>rate per line)");
        }
        log.info("✓ Rate feed: {}", config.rateFeed());

        if (!validator.isValidCurrency(config.tradeCurrency())) {
            throw new IllegalStateException(
                "INVALID CONFIG: TAXLOTS_TRADE_CURRENCY must be a three-letter code, got '" + config.tradeCurrency() + "'");
        }

        try {
            validator.validateRange(config.matchParallelism(), 1, MAX_PARALLELISM, "TAXLOTS_MATCH_PARALLELISM");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("INVALID CONFIG: " + e.getMessage(), e);
        }

        if (!config.splits().isEmpty()) {
            log.info("✓ Split adjustments: {}", config.splits());
        }

        log.info("✅ Startup config validation passed");
    }

    private StartupConfigValidator() {}
}
