package org.ashby.plot.generate;

import java.time.Instant;
import java.util.Map;

import org.ashby.plot.data.DataSourceRegistry;

/**
 * External inputs of one generation run.
 *
 * @param basisTime      reference time for templating and artifact placement
 * @param sources        data sources that dataset definitions may name
 * @param templateParams parameters given to the templating step, echoed into the output when the
 *                       definition declares no parameters of its own
 * @param colors         color name lookup
 */
public record PlotContext(
        Instant basisTime,
        DataSourceRegistry sources,
        Map<String, Object> templateParams,
        ColorTable colors) {

    public PlotContext {
        templateParams = templateParams == null ? Map.of() : templateParams;
        colors = colors == null ? ColorTable.empty() : colors;
    }
}
