package org.ashby.plot.figure;

import java.util.List;
import java.util.Map;

/**
 * Heatmap over a dense grid. {@code z} has one row per {@code y} label and one column per
 * {@code x} label; missing cells are null.
 */
public class HeatmapTrace extends Trace {

    public static final String VIRIDIS = "Viridis";

    public List<Object> x;
    public List<Object> y;
    public List<List<Object>> z;
    public String colorscale = VIRIDIS;
    public Boolean reversescale = Boolean.TRUE;
    public Map<String, Object> colorbar;

    public HeatmapTrace(String name) {
        super("heatmap", name);
    }
}
