package org.ashby.plot.definition;

import java.util.Map;

/**
 * A two-dimensional grid of values keyed by an x label and a y label.
 *
 * @param type     rendered form
 * @param name     display name
 * @param dataset  backing dataset name
 * @param labelsX  field holding the x label of each cell
 * @param labelsY  field holding the y label of each cell
 * @param values   field holding the cell value
 * @param colorbar optional plotly colorbar settings, passed through unchanged
 */
public record TableDefinition(
        TableType type,
        String name,
        String dataset,
        String labelsX,
        String labelsY,
        String values,
        Map<String, Object> colorbar) {
}
