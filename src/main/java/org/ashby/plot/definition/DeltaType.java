package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The kind of delta shown next to a scalar.
 */
public enum DeltaType {
    /** Percentage change of the scalar value against a reference value. */
    @JsonProperty("relative")
    RELATIVE
}
