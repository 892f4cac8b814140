package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Area fill for line series. Absent means no fill.
 */
public enum FillType {
    @JsonProperty("tozero")
    TO_ZERO
}
