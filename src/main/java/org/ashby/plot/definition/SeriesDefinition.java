package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A series of label/value pairs read from one dataset.
 * <p>
 * Grouping: when {@code groupField} is set and {@code groupValue} is {@value #GROUP_WILDCARD},
 * the definition fans out into one series per distinct value of the group field. With any other
 * group value only rows whose group field matches it exactly are used.
 *
 * @param type          rendered shape
 * @param name          display name, or name prefix for grouped series
 * @param color         color name or hex value
 * @param marker        point markers for line series
 * @param fill          area fill for line series
 * @param dataset       backing dataset name
 * @param labels        field holding the labels (x for vertical shapes), optional
 * @param values        field holding the values
 * @param groupField    optional field used to group rows
 * @param groupValue    group value to select, or the wildcard
 * @param hoverTemplate optional plotly hover template
 */
public record SeriesDefinition(
        SeriesType type,
        String name,
        String color,
        MarkerType marker,
        FillType fill,
        String dataset,
        String labels,
        String values,
        @JsonProperty("groupfield") String groupField,
        @JsonProperty("groupvalue") String groupValue,
        @JsonProperty("hovertemplate") String hoverTemplate) {

    /** Group value that creates one series per distinct group field value. */
    public static final String GROUP_WILDCARD = "*";

    public boolean isGrouped() {
        return groupField != null && !groupField.isEmpty();
    }

    public boolean isWildcardGroup() {
        return isGrouped() && GROUP_WILDCARD.equals(groupValue);
    }
}
