package org.ashby.plot.figure;

import java.util.List;

/**
 * Box plot. Values on {@code y} draw a vertical box, values on {@code x} a horizontal one.
 */
public class BoxTrace extends Trace {

    public List<Object> x;
    public List<Object> y;
    public String hovertemplate;
    public Marker marker;

    public BoxTrace(String name) {
        super("box", name);
    }
}
