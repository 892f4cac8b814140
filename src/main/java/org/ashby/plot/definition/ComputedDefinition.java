package org.ashby.plot.definition;

import java.util.List;

/**
 * A dataset derived from two others by joining them and applying a function.
 *
 * @param name     name of the derived dataset; must not clash with any other dataset
 * @param function registered predicate name, e.g. {@code diff}
 * @param datasets exactly two inputs, left first
 */
public record ComputedDefinition(String name, String function, List<ComputeInputDefinition> datasets) {

    public ComputedDefinition {
        datasets = datasets == null ? List.of() : List.copyOf(datasets);
    }
}
