package org.ashby.plot.api.data;

import org.ashby.plot.api.DataAccessException;

/**
 * A named capability that resolves a query into a dataset.
 * <p>
 * <strong>Thread Safety:</strong> implementations MUST be thread-safe. A single source instance
 * is shared by all generations of a batch run and is responsible for the concurrency safety
 * of any pooled resource it holds.
 */
public interface IDataSource {

    /**
     * Executes a query and returns its fully materialized result.
     *
     * @param query  source-specific query text
     * @param params positional query parameters
     * @return the dataset
     * @throws DataAccessException if the query cannot be executed
     */
    IDataSet getDataSet(String query, Object... params) throws DataAccessException;
}
