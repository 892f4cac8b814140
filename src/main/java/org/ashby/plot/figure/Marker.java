package org.ashby.plot.figure;

/**
 * Marker styling shared by bar, scatter and box traces.
 */
public class Marker {

    public String color;

    /** Point symbol, only meaningful for scatter traces. */
    public String symbol;

    public Marker() {
    }

    public Marker(String color) {
        this.color = color;
    }
}
