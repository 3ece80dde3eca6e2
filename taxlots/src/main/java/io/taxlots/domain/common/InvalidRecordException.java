package io.taxlots.domain.common;

/**
 * Exception thrown when an upstream record cannot be turned into a valid domain object.
 *
 * Raised at the ingestion boundary (or by record constructors) so that a malformed
 * record never reaches the lot matcher or the reconciler partially built.
 */
public class InvalidRecordException extends TaxDataException {

    private final String source;
    private final String location;

    public InvalidRecordException(String message) {
        this(null, null, message);
    }

    public InvalidRecordException(String source, String location, String message) {
        super(format(source, location, message));
        this.source = source;
        this.location = location;
    }

    public InvalidRecordException(String source, String location, String message, Throwable cause) {
        super(format(source, location, message), cause);
        this.source = source;
        this.location = location;
    }

    private static String format(String source, String location, String message) {
        if (source == null) {
            return message;
        }
        return String.format("[%s:%s] %s", source, location, message);
    }

    /**
     * File or feed the record came from, null for records built in code.
     */
    public String getSource() {
        return source;
    }

    /**
     * Line or row of the record inside its source.
     */
    public String getLocation() {
        return location;
    }
}
