package org.ashby.plot.generate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.ashby.plot.definition.SeriesDefinition;

/**
 * Accumulates the parallel label and value arrays of one named series while its dataset is
 * scanned.
 */
class LabeledSeries {

    /** Declaration order first, then display name. */
    static final Comparator<LabeledSeries> OUTPUT_ORDER =
        Comparator.comparingInt(LabeledSeries::getOrder).thenComparing(LabeledSeries::getName);

    private final String name;
    private final SeriesDefinition definition;
    private final int order;
    private final List<Object> labels = new ArrayList<>();
    private final List<Object> values = new ArrayList<>();

    LabeledSeries(String name, SeriesDefinition definition, int order) {
        this.name = name;
        this.definition = definition;
        this.order = order;
    }

    void addLabel(Object label) {
        labels.add(label);
    }

    void addValue(Object value) {
        values.add(value);
    }

    String getName() {
        return name;
    }

    SeriesDefinition getDefinition() {
        return definition;
    }

    int getOrder() {
        return order;
    }

    List<Object> getLabels() {
        return labels;
    }

    List<Object> getValues() {
        return values;
    }
}
