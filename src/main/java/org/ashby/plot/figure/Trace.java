package org.ashby.plot.figure;

/**
 * Base of every renderable chart primitive in the output document.
 * <p>
 * Subclasses are plain field holders serialized by Gson. Unset (null) fields are left out of the
 * JSON.
 */
public abstract class Trace {

    /** Plotly trace type, e.g. "bar" or "heatmap". */
    public final String type;

    /** Display name, shown in legends and hover labels. */
    public String name;

    protected Trace(String type, String name) {
        this.type = type;
        this.name = name;
    }
}
