package org.ashby.plot.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScalarType {
    @JsonProperty("number")
    NUMBER
}
