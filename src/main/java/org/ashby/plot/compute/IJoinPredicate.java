package org.ashby.plot.compute;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.data.FieldValue;

/**
 * A pure binary function applied to the value fields of two joined rows.
 */
@FunctionalInterface
public interface IJoinPredicate {

    /**
     * Combines a left and a right value.
     *
     * @param left  value from the streamed (left) dataset
     * @param right value from the materialized (right) dataset
     * @return the combined value
     * @throws DataAccessException if the operands cannot be combined
     */
    FieldValue apply(FieldValue left, FieldValue right) throws DataAccessException;
}
