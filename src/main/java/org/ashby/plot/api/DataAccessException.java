package org.ashby.plot.api;

/**
 * Thrown when data could not be read or combined: a source query failed, a dataset
 * iteration ended with an error, or a predicate received operands it cannot combine.
 */
public class DataAccessException extends PlotException {

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
