package org.ashby.plot.figure;

import java.util.List;

/**
 * A single number, optionally with a delta against a reference value.
 */
public class IndicatorTrace extends Trace {

    public static final String MODE_NUMBER = "number";
    public static final String MODE_NUMBER_AND_DELTA = "number+delta";

    public String mode = MODE_NUMBER;
    public Double value;
    public NumberStyle number;
    public Domain domain;
    public Title title;
    public Delta delta;

    public IndicatorTrace(String name) {
        super("indicator", name);
    }

    public static class NumberStyle {
        public String prefix;
        public String suffix;
    }

    /**
     * Horizontal placement: grid column and the fraction of the width covered.
     */
    public static class Domain {
        public Integer column;
        public List<Double> x;

        public Domain(int column, double from, double to) {
            this.column = column;
            this.x = List.of(from, to);
        }
    }

    public static class Title {
        public String text;

        public Title(String text) {
            this.text = text;
        }
    }

    public static class Delta {
        public Double reference;
        public Boolean relative;
        public String valueformat;
        public ColorHolder increasing;
        public ColorHolder decreasing;
    }

    public static class ColorHolder {
        public String color;

        public ColorHolder(String color) {
            this.color = color;
        }
    }
}
