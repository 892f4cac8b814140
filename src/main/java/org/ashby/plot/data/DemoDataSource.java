package org.ashby.plot.data;

import java.util.List;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.api.data.IDataSource;

/**
 * Built-in source with canned datasets for trying out plot definitions without a database.
 */
public class DemoDataSource implements IDataSource {

    @Override
    public IDataSet getDataSet(String query, Object... params) throws DataAccessException {
        if (query == null) {
            throw new DataAccessException("demo source needs a query");
        }
        return switch (query.trim()) {
            case "populations" -> StaticDataSet.builder()
                .column("creature", List.of("giraffes", "orangutans", "monkeys"))
                .column("month1", List.of(20, 14, 23))
                .column("month2", List.of(2, 18, 29))
                .build();
            default -> throw new DataAccessException("unknown demo dataset: " + query);
        };
    }
}
