package org.ashby.plot.compute;

import java.util.HashMap;
import java.util.Map;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.PlotException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.data.StaticDataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a new dataset from two existing ones with a streaming join.
 * <p>
 * <strong>Algorithm:</strong>
 * <ol>
 *   <li>Scan the right input once and index its value field by the canonical text of its join
 *       field. A later row with the same key overwrites an earlier one.</li>
 *   <li>Stream the left input once. Rows whose key has no match on the right are skipped.</li>
 *   <li>For matched rows, apply the predicate to (left value, right value) and append
 *       (left key, result) to the output.</li>
 * </ol>
 * The output has exactly two fields, {@value #KEY_FIELD} and {@value #VALUE_FIELD}, in left scan order.
 */
public class DataSetDeriver {

    private static final Logger log = LoggerFactory.getLogger(DataSetDeriver.class);

    public static final String KEY_FIELD = "key";
    public static final String VALUE_FIELD = "value";

    private final JoinPredicates predicates;

    public DataSetDeriver(JoinPredicates predicates) {
        this.predicates = predicates;
    }

    /**
     * One side of a derivation.
     *
     * @param dataSetName name of the dataset, used in error messages
     * @param dataSet     the rows
     * @param joinField   field whose canonical text is the join key
     * @param valueField  field passed to the predicate
     */
    public record ComputeInput(String dataSetName, IDataSet dataSet, String joinField, String valueField) {
    }

    /**
     * Joins two datasets and applies the named predicate to every matched pair of rows.
     *
     * @param predicateName registered predicate name
     * @param left          streamed side; determines output order
     * @param right         materialized side
     * @return the derived dataset
     * @throws PlotConfigurationException if the predicate is unknown
     * @throws DataAccessException        if a field cannot be read, an iteration fails or the predicate
     *                                    rejects its operands
     */
    public StaticDataSet derive(String predicateName, ComputeInput left, ComputeInput right) throws PlotException {
        IJoinPredicate predicate = predicates.get(predicateName);
        if (predicate == null) {
            throw new PlotConfigurationException("unknown function: \"" + predicateName + "\"");
        }

        Map<String, FieldValue> rightValues = indexRight(right);

        StaticDataSet.Builder out = StaticDataSet.builder().fields(KEY_FIELD, VALUE_FIELD);
        IDataSet ds = left.dataSet();
        ds.resetIterator();
        int matched = 0;
        int skipped = 0;
        while (ds.next()) {
            FieldValue join = read(left, left.joinField(), "join");
            FieldValue rightValue = rightValues.get(join.canonicalText());
            if (rightValue == null) {
                log.debug("No matching row for join field value '{}' in dataset '{}'",
                    join.canonicalText(), right.dataSetName());
                skipped++;
                continue;
            }
            FieldValue leftValue = read(left, left.valueField(), "value");
            FieldValue result;
            try {
                result = predicate.apply(leftValue, rightValue);
            } catch (DataAccessException e) {
                throw new DataAccessException("function \"" + predicateName + "\" on key '"
                    + join.canonicalText() + "': " + e.getMessage(), e);
            }
            out.row(join, result);
            matched++;
        }
        checkIteration(left);

        log.debug("Derived {} rows with '{}' from '{}' and '{}' ({} left rows unmatched)",
            matched, predicateName, left.dataSetName(), right.dataSetName(), skipped);
        return out.build();
    }

    private Map<String, FieldValue> indexRight(ComputeInput right) throws DataAccessException {
        Map<String, FieldValue> index = new HashMap<>();
        IDataSet ds = right.dataSet();
        ds.resetIterator();
        while (ds.next()) {
            FieldValue join = read(right, right.joinField(), "join");
            FieldValue value = read(right, right.valueField(), "value");
            index.put(join.canonicalText(), value);
        }
        checkIteration(right);
        return index;
    }

    private static FieldValue read(ComputeInput input, String field, String role) throws DataAccessException {
        FieldValue v = input.dataSet().field(field);
        if (v.isError()) {
            throw new DataAccessException(String.format("did not get %s field value \"%s\" from dataset \"%s\": %s",
                role, field, input.dataSetName(), v.getErrorMessage()));
        }
        return v;
    }

    private static void checkIteration(ComputeInput input) throws DataAccessException {
        Exception err = input.dataSet().getError();
        if (err != null) {
            throw new DataAccessException("dataset \"" + input.dataSetName() + "\" iteration ended with an error: "
                + err.getMessage(), err);
        }
    }
}
