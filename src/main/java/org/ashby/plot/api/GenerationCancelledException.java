package org.ashby.plot.api;

/**
 * Thrown at a cancellation checkpoint once another generation in the same batch has failed.
 */
public class GenerationCancelledException extends PlotException {

    public GenerationCancelledException(String plotName) {
        super("generation of plot '" + plotName + "' was cancelled");
    }
}
