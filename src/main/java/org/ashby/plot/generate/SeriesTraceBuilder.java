package org.ashby.plot.generate;

import java.util.ArrayList;
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
import org.ashby.plot.definition.FillType;
import org.ashby.plot.definition.SeriesDefinition;
import org.ashby.plot.definition.SeriesType;
import org.ashby.plot.figure.BarTrace;
import org.ashby.plot.figure.BoxTrace;
import org.ashby.plot.figure.Marker;
import org.ashby.plot.figure.ScatterTrace;
import org.ashby.plot.figure.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds bar, line and box traces from series definitions.
 * <p>
 * <strong>Algorithm:</strong>
 * <ol>
 *   <li>Partition the definitions by backing dataset, keeping each definition's declaration index.
 *       Definitions naming an unknown dataset are logged and skipped.</li>
 *   <li>Scan each dataset once. For every row and every definition on that dataset, derive the
 *       display name (fixed, fanned out per group value, or filtered by group value) and append
 *       label and value to the accumulator of that name, creating it on first sight.</li>
 *   <li>Order the accumulators by declaration index, then display name, and render each one.</li>
 * </ol>
 * A definition whose fields cannot be read is logged once and contributes no traces.
 */
class SeriesTraceBuilder {

    private static final Logger log = LoggerFactory.getLogger(SeriesTraceBuilder.class);

    private final String plotName;
    private final ColorTable colors;

    SeriesTraceBuilder(String plotName, ColorTable colors) {
        this.plotName = plotName;
        this.colors = colors;
    }

    private record IndexedSeries(int order, SeriesDefinition definition) {
    }

    List<Trace> build(Map<String, IDataSet> dataSets, List<SeriesDefinition> definitions) throws PlotException {
        Map<String, List<IndexedSeries>> byDataSet = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            SeriesDefinition def = definitions.get(i);
            if (!dataSets.containsKey(def.dataset())) {
                log.error("Plot '{}': unknown dataset name \"{}\" in series {}, skipping it", plotName, def.dataset(), i);
                continue;
            }
            byDataSet.computeIfAbsent(def.dataset(), k -> new ArrayList<>()).add(new IndexedSeries(i, def));
        }

        List<Trace> traces = new ArrayList<>();
        for (Map.Entry<String, List<IndexedSeries>> entry : byDataSet.entrySet()) {
            List<LabeledSeries> accumulated = scan(entry.getKey(), dataSets.get(entry.getKey()), entry.getValue());
            accumulated.sort(LabeledSeries.OUTPUT_ORDER);
            for (LabeledSeries series : accumulated) {
                traces.add(render(series));
            }
        }
        return traces;
    }

    private List<LabeledSeries> scan(String dataSetName, IDataSet ds, List<IndexedSeries> series)
            throws DataAccessException {
        List<LabeledSeries> data = new ArrayList<>();
        Map<String, LabeledSeries> index = new LinkedHashMap<>();
        Set<Integer> failed = new HashSet<>();

        log.info("Plot '{}': reading dataset '{}'", plotName, dataSetName);
        ds.resetIterator();
        int rowCount = 0;
        while (ds.next()) {
            rowCount++;
            for (IndexedSeries s : series) {
                if (failed.contains(s.order())) {
                    continue;
                }
                SeriesDefinition def = s.definition();
                String name = def.name() == null ? "" : def.name();
                if (def.isGrouped()) {
                    FieldValue group = ds.field(def.groupField());
                    if (group.isError()) {
                        fail(failed, s, dataSetName, def.groupField(), group);
                        continue;
                    }
                    if (def.isWildcardGroup()) {
                        name = name.isEmpty() ? group.canonicalText() : name + "-" + group.canonicalText();
                    } else if (!group.canonicalText().equals(def.groupValue() == null ? "" : def.groupValue())) {
                        continue;
                    }
                }

                FieldValue label = null;
                if (def.labels() != null && !def.labels().isEmpty()) {
                    label = ds.field(def.labels());
                    if (label.isError()) {
                        fail(failed, s, dataSetName, def.labels(), label);
                        continue;
                    }
                }
                FieldValue value = ds.field(def.values());
                if (value.isError()) {
                    fail(failed, s, dataSetName, def.values(), value);
                    continue;
                }

                LabeledSeries ls = index.get(name);
                if (ls == null) {
                    log.debug("Plot '{}': creating series '{}' from dataset '{}'", plotName, name, dataSetName);
                    ls = new LabeledSeries(name, def, s.order());
                    data.add(ls);
                    index.put(name, ls);
                }
                if (label != null) {
                    ls.addLabel(label.toJsonValue());
                }
                ls.addValue(value.toJsonValue());
            }
        }
        if (ds.getError() != null) {
            throw new DataAccessException("dataset \"" + dataSetName + "\" iteration ended with an error: "
                + ds.getError().getMessage(), ds.getError());
        }
        log.info("Plot '{}': finished reading dataset '{}' ({} rows)", plotName, dataSetName, rowCount);

        if (!failed.isEmpty()) {
            data.removeIf(ls -> failed.contains(ls.getOrder()));
        }
        return data;
    }

    private void fail(Set<Integer> failed, IndexedSeries s, String dataSetName, String field, FieldValue error) {
        failed.add(s.order());
        log.error("Plot '{}': series {} ('{}') cannot read field \"{}\" of dataset \"{}\": {}, skipping it",
            plotName, s.order(), s.definition().name(), field, dataSetName, error.getErrorMessage());
    }

    private Trace render(LabeledSeries ls) throws PlotConfigurationException {
        SeriesDefinition def = ls.getDefinition();
        if (def.type() == null) {
            throw new PlotConfigurationException("unsupported series type \"\" in series '" + ls.getName() + "'");
        }
        String color = colors.resolve(def.color());
        return switch (def.type()) {
            case BAR, HBAR -> {
                BarTrace trace = new BarTrace(ls.getName());
                boolean vertical = def.type() == SeriesType.BAR;
                trace.orientation = vertical ? BarTrace.VERTICAL : BarTrace.HORIZONTAL;
                trace.x = vertical ? labelsOrNull(ls) : ls.getValues();
                trace.y = vertical ? ls.getValues() : labelsOrNull(ls);
                trace.hovertemplate = def.hoverTemplate();
                if (color != null) {
                    trace.marker = new Marker(color);
                }
                yield trace;
            }
            case LINE -> {
                ScatterTrace trace = new ScatterTrace(ls.getName());
                trace.x = labelsOrNull(ls);
                trace.y = ls.getValues();
                trace.hovertemplate = def.hoverTemplate();
                if (def.fill() == FillType.TO_ZERO) {
                    trace.fill = ScatterTrace.FILL_TO_ZERO_Y;
                }
                if (def.marker() != null) {
                    trace.mode = ScatterTrace.MODE_LINES_AND_MARKERS;
                    trace.marker.symbol = def.marker().getSymbol();
                }
                trace.marker.color = color;
                yield trace;
            }
            case BOX, HBOX -> {
                BoxTrace trace = new BoxTrace(ls.getName());
                if (def.type() == SeriesType.BOX) {
                    trace.y = ls.getValues();
                } else {
                    trace.x = ls.getValues();
                }
                trace.hovertemplate = def.hoverTemplate();
                if (color != null) {
                    trace.marker = new Marker(color);
                }
                yield trace;
            }
        };
    }

    private static List<Object> labelsOrNull(LabeledSeries ls) {
        return ls.getLabels().isEmpty() ? null : ls.getLabels();
    }
}
