package org.ashby.plot.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;

/**
 * In-memory, column-oriented dataset.
 * <p>
 * Every source materializes its result into one of these, which is what makes
 * {@link #resetIterator()} cheap and repeatable. Columns keep their insertion order and
 * always have the same length.
 */
public class StaticDataSet implements IDataSet {

    private final Map<String, List<FieldValue>> columns;
    private final int rowCount;
    private int cursor = -1;
    private Exception error;

    private StaticDataSet(Map<String, List<FieldValue>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    /**
     * Creates a dataset from raw column values, converting each via {@link FieldValue#fromObject(Object)}.
     *
     * @param data column name to column values; all columns must have the same length
     * @return the dataset
     */
    public static StaticDataSet fromColumns(Map<String, ? extends List<?>> data) {
        Builder builder = builder();
        data.forEach((name, values) -> builder.column(name, values));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean next() {
        if (cursor < rowCount) {
            cursor++;
        }
        return cursor < rowCount;
    }

    @Override
    public Exception getError() {
        return error;
    }

    /**
     * Records a failure that ends the iteration abnormally. It is reported by {@link #getError()}
     * on every scan, so a reset does not clear it.
     *
     * @param error the failure to report through {@link #getError()}
     */
    public void setError(Exception error) {
        this.error = error;
    }

    @Override
    public FieldValue field(String name) {
        List<FieldValue> column = columns.get(name);
        if (column == null) {
            return FieldValue.error("unknown field \"" + name + "\"");
        }
        if (cursor < 0 || cursor >= rowCount) {
            return FieldValue.error("no current row");
        }
        return column.get(cursor);
    }

    @Override
    public void resetIterator() {
        cursor = -1;
    }

    /**
     * Returns an independent cursor over the same immutable rows.
     *
     * @return a new dataset positioned before the first row
     */
    public StaticDataSet copy() {
        StaticDataSet copy = new StaticDataSet(columns, rowCount);
        copy.error = error;
        return copy;
    }

    public int getRowCount() {
        return rowCount;
    }

    public List<String> getFieldNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Builder for column-oriented datasets. Columns may be added whole or filled row by row.
     */
    public static class Builder {
        private final Map<String, List<FieldValue>> columns = new LinkedHashMap<>();

        /**
         * Adds a whole column, converting raw values.
         *
         * @param name   column name
         * @param values raw values
         * @return this builder
         */
        public Builder column(String name, List<?> values) {
            List<FieldValue> converted = new ArrayList<>(values.size());
            for (Object v : values) {
                converted.add(FieldValue.fromObject(v));
            }
            columns.put(name, converted);
            return this;
        }

        /**
         * Adds a whole column from raw values.
         *
         * @param name   column name
         * @param values raw values
         * @return this builder
         */
        public Builder column(String name, Object... values) {
            return column(name, java.util.Arrays.asList(values));
        }

        /**
         * Declares the column names for row-wise filling.
         *
         * @param names column names in order
         * @return this builder
         */
        public Builder fields(String... names) {
            for (String name : names) {
                columns.putIfAbsent(name, new ArrayList<>());
            }
            return this;
        }

        /**
         * Appends one row. Values are matched positionally to the declared fields.
         *
         * @param values one value per declared field
         * @return this builder
         */
        public Builder row(FieldValue... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                    "row has " + values.length + " values but dataset has " + columns.size() + " fields");
            }
            int i = 0;
            for (List<FieldValue> column : columns.values()) {
                column.add(values[i++]);
            }
            return this;
        }

        public StaticDataSet build() {
            int rowCount = -1;
            Map<String, List<FieldValue>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, List<FieldValue>> e : columns.entrySet()) {
                if (rowCount >= 0 && e.getValue().size() != rowCount) {
                    throw new IllegalArgumentException(
                        "column \"" + e.getKey() + "\" has " + e.getValue().size() + " values, expected " + rowCount);
                }
                rowCount = e.getValue().size();
                frozen.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
            }
            return new StaticDataSet(Collections.unmodifiableMap(frozen), Math.max(rowCount, 0));
        }
    }
}
