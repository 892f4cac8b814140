package org.ashby.plot.api;

/**
 * Base class for failures that abort the generation of a whole plot document.
 * <p>
 * Conditions that only affect a single chart element (an unknown dataset name in a series,
 * a missing scalar field) are not exceptions: they are logged and the element is skipped.
 */
public class PlotException extends Exception {

    public PlotException(String message) {
        super(message);
    }

    public PlotException(String message, Throwable cause) {
        super(message, cause);
    }
}
