package org.ashby.plot.generate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.definition.TableDefinition;
import org.ashby.plot.figure.Annotation;

/**
 * Accumulates the cells of one table while its dataset is scanned.
 * <p>
 * Labels are kept in first-seen order on each axis. Cells are keyed by the canonical text of
 * their labels, so each (x, y) pair may be filled only once.
 */
class LabeledTable {

    private final String name;
    private final TableDefinition definition;
    private final int order;

    private final Map<String, Object> labelsX = new LinkedHashMap<>();
    private final Map<String, Object> labelsY = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldValue>> cells = new HashMap<>();

    LabeledTable(String name, TableDefinition definition, int order) {
        this.name = name;
        this.definition = definition;
        this.order = order;
    }

    /**
     * Records one cell.
     *
     * @throws PlotConfigurationException if the cell already has a value
     */
    void put(FieldValue x, FieldValue y, FieldValue value) throws PlotConfigurationException {
        String xKey = x.canonicalText();
        String yKey = y.canonicalText();
        labelsX.putIfAbsent(xKey, x.toJsonValue());
        labelsY.putIfAbsent(yKey, y.toJsonValue());
        Map<String, FieldValue> column = cells.computeIfAbsent(xKey, k -> new HashMap<>());
        if (column.containsKey(yKey)) {
            throw new PlotConfigurationException("table '" + name + "': found two values for " + xKey + "/" + yKey);
        }
        column.put(yKey, value);
    }

    /**
     * Returns the dense grid, one row per y label and one column per x label. Missing cells are null.
     */
    List<List<Object>> valueZ() {
        List<List<Object>> z = new ArrayList<>(labelsY.size());
        for (String y : labelsY.keySet()) {
            List<Object> row = new ArrayList<>(labelsX.size());
            for (String x : labelsX.keySet()) {
                FieldValue v = cell(x, y);
                row.add(v == null ? null : v.toJsonValue());
            }
            z.add(row);
        }
        return z;
    }

    /**
     * Returns one annotation per cell, row by row.
     */
    List<Annotation> annotations() {
        List<Annotation> result = new ArrayList<>(labelsX.size() * labelsY.size());
        for (Map.Entry<String, Object> y : labelsY.entrySet()) {
            for (Map.Entry<String, Object> x : labelsX.entrySet()) {
                result.add(new Annotation(x.getValue(), y.getValue(), cellText(cell(x.getKey(), y.getKey()))));
            }
        }
        return result;
    }

    private FieldValue cell(String x, String y) {
        Map<String, FieldValue> column = cells.get(x);
        return column == null ? null : column.get(y);
    }

    static String cellText(FieldValue v) {
        if (v == null || v.isAbsent()) {
            return "";
        }
        if (v.isNumeric()) {
            return String.format(Locale.ROOT, "%.3f", v.toDouble());
        }
        return v.canonicalText();
    }

    String getName() {
        return name;
    }

    TableDefinition getDefinition() {
        return definition;
    }

    int getOrder() {
        return order;
    }

    List<Object> getLabelsX() {
        return new ArrayList<>(labelsX.values());
    }

    List<Object> getLabelsY() {
        return new ArrayList<>(labelsY.values());
    }
}
