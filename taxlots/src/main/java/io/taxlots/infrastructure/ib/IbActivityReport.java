package io.taxlots.infrastructure.ib;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsed IB activity statement: section name to its data rows.
 */
public record IbActivityReport(
        String source,
        Map<String, List<IbRecord>> tables) {

    public static final String TRADES = "Trades";
    public static final String DIVIDENDS = "Dividends";
    public static final String WITHHOLDING_TAX = "Withholding Tax";

    public IbActivityReport {
        tables = tables.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    /**
     * Rows of a section, empty if the statement has no such section.
     */
    public List<IbRecord> table(String name) {
        return tables.getOrDefault(name, List.of());
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }
}
