package org.ashby.plot.generate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.definition.TableDefinition;
import org.ashby.plot.definition.TableType;
import org.ashby.plot.figure.Annotation;
import org.ashby.plot.figure.HeatmapTrace;
import org.ashby.plot.figure.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds heatmap traces, plus one annotation per cell, from table definitions.
 */
class TableTraceBuilder {

    private static final Logger log = LoggerFactory.getLogger(TableTraceBuilder.class);

    private static final Comparator<LabeledTable> OUTPUT_ORDER =
        Comparator.comparingInt(LabeledTable::getOrder).thenComparing(LabeledTable::getName);

    private final String plotName;
    private final List<Annotation> annotations = new ArrayList<>();

    TableTraceBuilder(String plotName) {
        this.plotName = plotName;
    }

    private record IndexedTable(int order, TableDefinition definition) {
    }

    List<Trace> build(Map<String, IDataSet> dataSets, List<TableDefinition> definitions) throws PlotException {
        Map<String, List<IndexedTable>> byDataSet = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            TableDefinition t = definitions.get(i);
            if (!dataSets.containsKey(t.dataset())) {
                log.error("Plot '{}': unknown dataset name \"{}\" in table {}, skipping it", plotName, t.dataset(), i);
                continue;
            }
            byDataSet.computeIfAbsent(t.dataset(), k -> new ArrayList<>()).add(new IndexedTable(i, t));
        }

        List<Trace> traces = new ArrayList<>();
        for (Map.Entry<String, List<IndexedTable>> entry : byDataSet.entrySet()) {
            List<LabeledTable> tables = scan(entry.getKey(), dataSets.get(entry.getKey()), entry.getValue());
            tables.sort(OUTPUT_ORDER);
            for (LabeledTable lt : tables) {
                if (lt.getDefinition().type() != TableType.HEATMAP) {
                    throw new PlotConfigurationException("unsupported table type \""
                        + (lt.getDefinition().type() == null ? "" : lt.getDefinition().type()) + "\" in table '"
                        + lt.getName() + "'");
                }
                HeatmapTrace trace = new HeatmapTrace(lt.getName());
                trace.x = lt.getLabelsX();
                trace.y = lt.getLabelsY();
                trace.z = lt.valueZ();
                trace.colorbar = lt.getDefinition().colorbar();
                traces.add(trace);
                annotations.addAll(lt.annotations());
            }
        }
        return traces;
    }

    private List<LabeledTable> scan(String dataSetName, IDataSet ds, List<IndexedTable> tables) throws PlotException {
        List<LabeledTable> data = new ArrayList<>();
        Map<String, LabeledTable> index = new LinkedHashMap<>();
        Set<Integer> failed = new HashSet<>();

        log.info("Plot '{}': reading dataset '{}'", plotName, dataSetName);
        ds.resetIterator();
        while (ds.next()) {
            for (IndexedTable t : tables) {
                if (failed.contains(t.order())) {
                    continue;
                }
                TableDefinition def = t.definition();
                FieldValue x = ds.field(def.labelsX());
                FieldValue y = ds.field(def.labelsY());
                FieldValue z = ds.field(def.values());
                FieldValue broken = x.isError() ? x : y.isError() ? y : z.isError() ? z : null;
                if (broken != null) {
                    failed.add(t.order());
                    log.error("Plot '{}': table '{}' cannot read dataset \"{}\": {}, skipping it",
                        plotName, def.name(), dataSetName, broken.getErrorMessage());
                    continue;
                }

                String name = def.name() == null ? "" : def.name();
                LabeledTable lt = index.get(name);
                if (lt == null) {
                    log.debug("Plot '{}': creating table '{}'", plotName, name);
                    lt = new LabeledTable(name, def, t.order());
                    data.add(lt);
                    index.put(name, lt);
                }
                lt.put(x, y, z);
            }
        }
        if (ds.getError() != null) {
            throw new DataAccessException("dataset \"" + dataSetName + "\" iteration ended with an error: "
                + ds.getError().getMessage(), ds.getError());
        }

        if (!failed.isEmpty()) {
            data.removeIf(lt -> failed.contains(lt.getOrder()));
        }
        return data;
    }

    /**
     * Returns the annotations of every heatmap built so far, in trace order.
     */
    List<Annotation> getAnnotations() {
        return annotations;
    }
}
