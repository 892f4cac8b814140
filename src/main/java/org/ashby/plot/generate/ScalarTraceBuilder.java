package org.ashby.plot.generate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.definition.DeltaType;
import org.ashby.plot.definition.ScalarDefinition;
import org.ashby.plot.figure.IndicatorTrace;
import org.ashby.plot.figure.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds indicator traces from scalar definitions.
 * <p>
 * Only the first row of each referenced dataset is read, once per dataset no matter how many
 * scalars use it. Scalars are laid out side by side: scalar {@code i} of {@code n} occupies grid
 * column {@code i} and the horizontal range {@code [i/n, (i+1)/n]}. A scalar whose value or delta
 * cannot be read is logged and left out; its slot stays empty.
 */
class ScalarTraceBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScalarTraceBuilder.class);

    static final String RELATIVE_DELTA_FORMAT = ".2%";

    private final String plotName;
    private final ColorTable colors;

    ScalarTraceBuilder(String plotName, ColorTable colors) {
        this.plotName = plotName;
        this.colors = colors;
    }

    List<Trace> build(Map<String, IDataSet> dataSets, List<ScalarDefinition> definitions)
            throws PlotConfigurationException {
        Map<String, Set<String>> fieldsUsed = new LinkedHashMap<>();
        for (ScalarDefinition s : definitions) {
            if (!dataSets.containsKey(s.dataset())) {
                log.error("Plot '{}': unknown dataset name \"{}\" for scalar '{}', skipping it", plotName, s.dataset(), s.name());
                continue;
            }
            fieldsUsed.computeIfAbsent(s.dataset(), k -> new LinkedHashSet<>()).add(s.value());
            if (s.hasDelta()) {
                if (!dataSets.containsKey(s.deltaDataset())) {
                    log.error("Plot '{}': unknown delta dataset name \"{}\" for scalar '{}', skipping it",
                        plotName, s.deltaDataset(), s.name());
                    continue;
                }
                fieldsUsed.computeIfAbsent(s.deltaDataset(), k -> new LinkedHashSet<>()).add(s.deltaValue());
            }
        }

        Map<String, Map<String, Double>> firstRows = new HashMap<>();
        for (Map.Entry<String, Set<String>> e : fieldsUsed.entrySet()) {
            Map<String, Double> values = readFirstRow(e.getKey(), dataSets.get(e.getKey()), e.getValue());
            if (values != null) {
                firstRows.put(e.getKey(), values);
            }
        }

        List<Trace> traces = new ArrayList<>();
        double width = definitions.isEmpty() ? 0 : 1.0 / definitions.size();
        for (int idx = 0; idx < definitions.size(); idx++) {
            ScalarDefinition s = definitions.get(idx);
            if (s.type() == null) {
                throw new PlotConfigurationException("unsupported scalar type \"\" for scalar '" + s.name() + "'");
            }

            Double value = lookup(firstRows, s.dataset(), s.value());
            if (value == null) {
                log.error("Plot '{}': missing value field \"{}\" for scalar '{}', skipping it", plotName, s.value(), s.name());
                continue;
            }

            IndicatorTrace trace = new IndicatorTrace(s.name());
            trace.value = value;
            trace.domain = new IndicatorTrace.Domain(idx, width * idx, width * (idx + 1));
            trace.title = new IndicatorTrace.Title(s.name());
            if (notEmpty(s.valuePrefix()) || notEmpty(s.valueSuffix())) {
                trace.number = new IndicatorTrace.NumberStyle();
                trace.number.prefix = s.valuePrefix();
                trace.number.suffix = s.valueSuffix();
            }

            if (s.hasDelta()) {
                Double reference = lookup(firstRows, s.deltaDataset(), s.deltaValue());
                if (reference == null) {
                    log.error("Plot '{}': missing delta value field \"{}\" for scalar '{}', skipping it",
                        plotName, s.deltaValue(), s.name());
                    continue;
                }
                if (s.deltaType() != DeltaType.RELATIVE) {
                    throw new PlotConfigurationException("unsupported delta type \""
                        + (s.deltaType() == null ? "" : s.deltaType()) + "\" for scalar '" + s.name() + "'");
                }
                trace.mode = IndicatorTrace.MODE_NUMBER_AND_DELTA;
                trace.delta = relativeDelta(s, value, reference);
            }
            traces.add(trace);
        }
        return traces;
    }

    private IndicatorTrace.Delta relativeDelta(ScalarDefinition s, double value, double reference) {
        IndicatorTrace.Delta delta = new IndicatorTrace.Delta();
        delta.reference = reference;
        delta.relative = Boolean.TRUE;
        delta.valueformat = RELATIVE_DELTA_FORMAT;
        double change = value - reference;
        if (change > 0) {
            String c = colors.resolve(s.increaseColor());
            if (c != null) {
                delta.increasing = new IndicatorTrace.ColorHolder(c);
            }
        } else if (change < 0) {
            String c = colors.resolve(s.decreaseColor());
            if (c != null) {
                delta.decreasing = new IndicatorTrace.ColorHolder(c);
            }
        }
        return delta;
    }

    private Map<String, Double> readFirstRow(String dataSetName, IDataSet ds, Set<String> fields) {
        log.info("Plot '{}': reading first row of dataset '{}'", plotName, dataSetName);
        ds.resetIterator();
        if (!ds.next()) {
            if (ds.getError() != null) {
                log.error("Plot '{}': error reading dataset \"{}\": {}", plotName, dataSetName, ds.getError().getMessage());
            } else {
                log.error("Plot '{}': no rows found for dataset \"{}\"", plotName, dataSetName);
            }
            return null;
        }
        Map<String, Double> values = new HashMap<>();
        for (String field : fields) {
            FieldValue v = ds.field(field);
            if (v.isNumeric() && Double.isFinite(v.toDouble())) {
                values.put(field, v.toDouble());
            } else {
                log.error("Plot '{}': field \"{}\" not read from dataset \"{}\": {}", plotName, field, dataSetName,
                    v.isError() ? v.getErrorMessage() : "value is " + (v.isNumeric() ? v.toDouble() : v.getKind()));
            }
        }
        return values;
    }

    private static Double lookup(Map<String, Map<String, Double>> firstRows, String dataSet, String field) {
        Map<String, Double> row = firstRows.get(dataSet);
        return row == null ? null : row.get(field);
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
