package org.ashby.plot.figure;

/**
 * A text label placed on the first axis pair, used to print heatmap cell values.
 */
public class Annotation {

    public String xref = "x1";
    public String yref = "y1";
    public Object x;
    public Object y;
    public String text;
    public boolean showarrow;

    public Annotation(Object x, Object y, String text) {
        this.x = x;
        this.y = y;
        this.text = text;
    }
}
