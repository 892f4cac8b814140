package org.ashby.plot.definition;

/**
 * A single number read from the first row of a dataset, optionally with a delta against a
 * value from a second dataset.
 */
public record ScalarDefinition(
        ScalarType type,
        String name,
        String color,
        String dataset,
        String value,
        String valuePrefix,
        String valueSuffix,
        String deltaDataset,
        String deltaValue,
        DeltaType deltaType,
        String increaseColor,
        String decreaseColor) {

    public boolean hasDelta() {
        return deltaDataset != null && !deltaDataset.isEmpty();
    }
}
