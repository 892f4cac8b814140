package org.ashby.plot.generate;

import java.util.List;
import java.util.Map;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.data.StaticDataSet;
import org.ashby.plot.definition.FillType;
import org.ashby.plot.definition.MarkerType;
import org.ashby.plot.definition.SeriesDefinition;
import org.ashby.plot.definition.SeriesType;
import org.ashby.plot.figure.BarTrace;
import org.ashby.plot.figure.BoxTrace;
import org.ashby.plot.figure.ScatterTrace;
import org.ashby.plot.figure.Trace;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for series accumulation: grouping, ordering and per-shape rendering.
 */
@Tag("unit")
class SeriesTraceBuilderTest {

    private final SeriesTraceBuilder builder =
        new SeriesTraceBuilder("test-plot", new ColorTable("#000000", Map.of("blue", "#1f77b4")));

    private static SeriesDefinition series(SeriesType type, String name, String dataset, String labels, String values,
                                           String groupField, String groupValue) {
        return new SeriesDefinition(type, name, null, null, null, dataset, labels, values, groupField, groupValue, null);
    }

    private static Map<String, IDataSet> sales() {
        return Map.of("sales", StaticDataSet.builder()
            .column("region", "south", "north", "south", "north")
            .column("month", "jan", "jan", "feb", "feb")
            .column("units", 5, 7, 6, 8)
            .build());
    }

    @Test
    void testWildcardGroupFansOutSortedByName() throws Exception {
        List<Trace> traces = builder.build(sales(),
            List.of(series(SeriesType.LINE, "units", "sales", "month", "units", "region", "*")));

        assertThat(traces).extracting(t -> t.name).containsExactly("units-north", "units-south");
        ScatterTrace north = (ScatterTrace) traces.get(0);
        assertThat(north.x).containsExactly("jan", "feb");
        assertThat(north.y).containsExactly(7L, 8L);
    }

    @Test
    void testWildcardGroupWithoutNameUsesGroupValue() throws Exception {
        List<Trace> traces = builder.build(sales(),
            List.of(series(SeriesType.BAR, null, "sales", "month", "units", "region", "*")));

        assertThat(traces).extracting(t -> t.name).containsExactly("north", "south");
    }

    @Test
    void testFixedGroupValueFiltersRows() throws Exception {
        List<Trace> traces = builder.build(sales(),
            List.of(series(SeriesType.BAR, "South", "sales", "month", "units", "region", "south")));

        assertThat(traces).hasSize(1);
        BarTrace bar = (BarTrace) traces.get(0);
        assertThat(bar.orientation).isEqualTo(BarTrace.VERTICAL);
        assertThat(bar.x).containsExactly("jan", "feb");
        assertThat(bar.y).containsExactly(5L, 6L);
    }

    @Test
    void testDeclarationOrderBeatsName() throws Exception {
        List<Trace> traces = builder.build(sales(), List.of(
            series(SeriesType.LINE, "zeta", "sales", "month", "units", null, null),
            series(SeriesType.LINE, "alpha", "sales", "month", "units", null, null)));

        assertThat(traces).extracting(t -> t.name).containsExactly("zeta", "alpha");
    }

    @Test
    void testHorizontalBarSwapsAxes() throws Exception {
        List<Trace> traces = builder.build(sales(),
            List.of(series(SeriesType.HBAR, "h", "sales", "region", "units", null, null)));

        BarTrace bar = (BarTrace) traces.get(0);
        assertThat(bar.orientation).isEqualTo(BarTrace.HORIZONTAL);
        assertThat(bar.x).containsExactly(5L, 7L, 6L, 8L);
        assertThat(bar.y).containsExactly("south", "north", "south", "north");
    }

    @Test
    void testBoxUsesValuesOnly() throws Exception {
        List<Trace> traces = builder.build(sales(), List.of(
            series(SeriesType.BOX, "v", "sales", null, "units", null, null),
            series(SeriesType.HBOX, "h", "sales", null, "units", null, null)));

        assertThat(((BoxTrace) traces.get(0)).y).containsExactly(5L, 7L, 6L, 8L);
        assertThat(((BoxTrace) traces.get(0)).x).isNull();
        assertThat(((BoxTrace) traces.get(1)).x).containsExactly(5L, 7L, 6L, 8L);
    }

    @Test
    void testLineMarkerFillAndNamedColor() throws Exception {
        SeriesDefinition def = new SeriesDefinition(SeriesType.LINE, "l", "blue", MarkerType.TRIANGLE, FillType.TO_ZERO,
            "sales", "month", "units", null, null, "%{y} units");

        ScatterTrace line = (ScatterTrace) builder.build(sales(), List.of(def)).get(0);

        assertThat(line.mode).isEqualTo(ScatterTrace.MODE_LINES_AND_MARKERS);
        assertThat(line.marker.symbol).isEqualTo("triangle-up");
        assertThat(line.marker.color).isEqualTo("#1f77b4");
        assertThat(line.fill).isEqualTo(ScatterTrace.FILL_TO_ZERO_Y);
        assertThat(line.hovertemplate).isEqualTo("%{y} units");
    }

    @Test
    void testUnknownDatasetIsSkipped() throws Exception {
        List<Trace> traces = builder.build(sales(), List.of(
            series(SeriesType.LINE, "ghost", "nope", "month", "units", null, null),
            series(SeriesType.LINE, "real", "sales", "month", "units", null, null)));

        assertThat(traces).extracting(t -> t.name).containsExactly("real");
    }

    @Test
    void testUnreadableFieldDropsOnlyThatSeries() throws Exception {
        List<Trace> traces = builder.build(sales(), List.of(
            series(SeriesType.LINE, "broken", "sales", "month", "missing", null, null),
            series(SeriesType.LINE, "ok", "sales", "month", "units", null, null)));

        assertThat(traces).extracting(t -> t.name).containsExactly("ok");
    }

    @Test
    void testDatasetIterationError_throws() {
        StaticDataSet ds = StaticDataSet.builder().column("month", "jan").column("units", 1).build();
        ds.setError(new IllegalStateException("cursor closed"));

        assertThatThrownBy(() -> builder.build(Map.of("sales", ds),
            List.of(series(SeriesType.LINE, "l", "sales", "month", "units", null, null))))
            .isInstanceOf(DataAccessException.class)
            .hasMessageContaining("sales")
            .hasMessageContaining("cursor closed");
    }
}
