package org.ashby.plot.figure;

import java.util.List;

/**
 * Vertical ({@code orientation = "v"}) or horizontal ({@code "h"}) bars.
 */
public class BarTrace extends Trace {

    public static final String VERTICAL = "v";
    public static final String HORIZONTAL = "h";

    public String orientation;
    public List<Object> x;
    public List<Object> y;
    public String hovertemplate;
    public Marker marker;

    public BarTrace(String name) {
        super("bar", name);
    }
}
