package org.ashby.plot.figure;

import java.util.List;

public class ScatterTrace extends Trace {

    public static final String MODE_LINES = "lines";
    public static final String MODE_LINES_AND_MARKERS = "lines+markers";
    public static final String FILL_TO_ZERO_Y = "tozeroy";

    public List<Object> x;
    public List<Object> y;
    public String mode = MODE_LINES;
    public String fill;
    public String hovertemplate;
    public Marker marker = new Marker();

    public ScatterTrace(String name) {
        super("scatter", name);
    }
}
