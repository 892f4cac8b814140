package org.ashby.plot.definition;

/**
 * One input of a computed dataset.
 *
 * @param dataset    name of an already declared dataset
 * @param joinField  field used to match rows between the inputs
 * @param valueField field passed to the compute function
 */
public record ComputeInputDefinition(String dataset, String joinField, String valueField) {
}
