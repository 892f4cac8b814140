package org.ashby.plot.api.data;

/**
 * A resettable, forward-only cursor over rows of named, typed fields.
 * <p>
 * Usage follows the JDBC cursor shape:
 * <pre>{@code
 * dataSet.resetIterator();
 * while (dataSet.next()) {
 *     FieldValue v = dataSet.field("value");
 * }
 * if (dataSet.getError() != null) {
 *     // iteration ended abnormally
 * }
 * }</pre>
 * <p>
 * <strong>Stability:</strong> a full scan after {@link #resetIterator()} observes exactly the
 * values of any previous full scan. Resetting never re-executes the query that produced
 * the rows.
 * <p>
 * <strong>Thread Safety:</strong> instances belong to a single plot generation and are not
 * thread-safe.
 */
public interface IDataSet {

    /**
     * Advances the cursor to the next row.
     *
     * @return true if a row is available, false at the end of the rows or on error
     */
    boolean next();

    /**
     * Returns the error that ended the iteration, if any.
     *
     * @return the error, or null if iteration ended normally or is still in progress
     */
    Exception getError();

    /**
     * Reads a field of the current row.
     *
     * @param name field name
     * @return the value; {@link FieldValue.Kind#ERROR} if the field does not exist or no row
     *         is current
     */
    FieldValue field(String name);

    /**
     * Rewinds the cursor to before the first row. May be called any number of times.
     */
    void resetIterator();
}
