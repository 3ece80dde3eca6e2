package io.taxlots.infrastructure.ib;

import io.taxlots.domain.common.InvalidRecordException;

import java.util.Map;

/**
 * One {@code Data} row of an IB activity statement, keyed by its section header.
 */
public record IbRecord(
        String source,
        int rowNumber,
        Map<String, String> fields) {

    public IbRecord {
        fields = Map.copyOf(fields);
    }

    /**
     * Field value, or null when the section has no such column.
     */
    public String get(String key) {
        return fields.get(key);
    }

    /**
     * Non-blank field value.
     *
     * @throws InvalidRecordException if the column is missing or empty
     */
    public String require(String key) {
        String value = fields.get(key);
        if (value == null || value.isBlank()) {
            throw new InvalidRecordException(source, location(), "Missing field '" + key + "'");
        }
        return value.trim();
    }

    public String location() {
        return "row " + rowNumber;
    }
}
