package io.taxlots.domain.common;

/**
 * Base for data-correctness failures that end a batch run.
 *
 * These are never retried: the input has to be corrected by an operator
 * and the run started again.
 */
public abstract class TaxDataException extends RuntimeException {

    protected TaxDataException(String message) {
        super(message);
    }

    protected TaxDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
