package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point markers for line series. Only a subset of the symbols plotly supports.
 */
public enum MarkerType {
    @JsonProperty("circle")
    CIRCLE("circle"),
    @JsonProperty("square")
    SQUARE("square"),
    @JsonProperty("diamond")
    DIAMOND("diamond"),
    @JsonProperty("triangle")
    TRIANGLE("triangle-up"),
    @JsonProperty("hexagon")
    HEXAGON("hexagon");

    private final String symbol;

    MarkerType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the plotly marker symbol name.
     *
     * @return symbol name
     */
    public String getSymbol() {
        return symbol;
    }
}
