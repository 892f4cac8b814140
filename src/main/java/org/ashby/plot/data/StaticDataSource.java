package org.ashby.plot.data;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.api.data.IDataSource;

/**
 * In-memory fixture source. The query string is the name under which a dataset was registered.
 * <p>
 * Each call hands out a fresh cursor over the registered rows, so concurrent generations never
 * share iteration state.
 */
public class StaticDataSource implements IDataSource {

    private final Map<String, StaticDataSet> fixtures = new ConcurrentHashMap<>();

    /**
     * Registers a dataset under a query name, replacing any previous registration.
     *
     * @param query   the query text that resolves to this dataset
     * @param dataSet the rows to serve
     * @return this source
     */
    public StaticDataSource register(String query, StaticDataSet dataSet) {
        fixtures.put(query, dataSet);
        return this;
    }

    @Override
    public IDataSet getDataSet(String query, Object... params) throws DataAccessException {
        StaticDataSet dataSet = query == null ? null : fixtures.get(query);
        if (dataSet == null) {
            throw new DataAccessException("unknown static dataset: " + query);
        }
        return dataSet.copy();
    }
}
