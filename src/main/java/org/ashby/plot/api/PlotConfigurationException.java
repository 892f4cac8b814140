package org.ashby.plot.api;

/**
 * Thrown when a plot definition references something that cannot exist.
 * <p>
 * Typical causes:
 * <ul>
 *   <li>Unknown data source, predicate, series shape, scalar delta or table type</li>
 *   <li>Computed dataset with the wrong number of inputs or a conflicting name</li>
 *   <li>Two values for the same cell of a table</li>
 *   <li>Malformed definition text or template expressions</li>
 * </ul>
 */
public class PlotConfigurationException extends PlotException {

    public PlotConfigurationException(String message) {
        super(message);
    }

    public PlotConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
