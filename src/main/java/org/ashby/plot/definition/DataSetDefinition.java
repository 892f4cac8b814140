package org.ashby.plot.definition;

/**
 * A dataset fetched from a named source.
 *
 * @param name   name referenced by chart elements and computed datasets
 * @param source name of a registered data source
 * @param query  source-specific query text
 */
public record DataSetDefinition(String name, String source, String query) {
}
