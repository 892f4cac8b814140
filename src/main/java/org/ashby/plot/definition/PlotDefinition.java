package org.ashby.plot.definition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed plot definition document.
 * <p>
 * All lists keep declaration order; the position of a series or table in its list is the
 * declaration-order index used to order the generated traces. The {@code layout} and
 * {@code config} maps are passed into the output document without interpretation.
 */
public record PlotDefinition(
        String name,
        PlotFrequency frequency,
        List<DataSetDefinition> datasets,
        List<ComputedDefinition> computed,
        List<SeriesDefinition> series,
        List<ScalarDefinition> scalars,
        List<TableDefinition> tables,
        Map<String, Object> layout,
        Map<String, Object> config,
        Map<String, Object> parameters) {

    public PlotDefinition {
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
        computed = computed == null ? List.of() : List.copyOf(computed);
        series = series == null ? List.of() : List.copyOf(series);
        scalars = scalars == null ? List.of() : List.copyOf(scalars);
        tables = tables == null ? List.of() : List.copyOf(tables);
        layout = layout == null ? new LinkedHashMap<>() : layout;
        config = config == null ? new LinkedHashMap<>() : config;
    }

    /**
     * Returns a copy with a different name.
     *
     * @param newName the name
     * @return the renamed definition
     */
    public PlotDefinition withName(String newName) {
        return new PlotDefinition(newName, frequency, datasets, computed, series, scalars, tables,
            layout, config, parameters);
    }
}
