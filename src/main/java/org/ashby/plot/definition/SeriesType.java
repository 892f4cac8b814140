package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The shape a series is rendered as.
 */
public enum SeriesType {
    /** Vertical bars */
    @JsonProperty("bar")
    BAR("bar"),

    /** Horizontal bars */
    @JsonProperty("hbar")
    HBAR("hbar"),

    /** Lines, optionally with markers or fill */
    @JsonProperty("line")
    LINE("line"),

    /** Vertical box plot */
    @JsonProperty("box")
    BOX("box"),

    /** Horizontal box plot */
    @JsonProperty("hbox")
    HBOX("hbox");

    private final String key;

    SeriesType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
