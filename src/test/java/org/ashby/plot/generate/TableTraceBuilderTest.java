package org.ashby.plot.generate;

import java.util.List;
import java.util.Map;

import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.api.data.FieldValue;
import org.ashby.plot.api.data.IDataSet;
import org.ashby.plot.data.StaticDataSet;
import org.ashby.plot.definition.TableDefinition;
import org.ashby.plot.definition.TableType;
import org.ashby.plot.figure.HeatmapTrace;
import org.ashby.plot.figure.Trace;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TableTraceBuilderTest {

    private static final TableDefinition LOAD =
        new TableDefinition(TableType.HEATMAP, "load", "grid", "day", "hour", "value", Map.of("title", "Load"));

    @Test
    void testDenseGridWithAnnotationsAndHoles() throws Exception {
        Map<String, IDataSet> data = Map.of("grid", StaticDataSet.builder()
            .column("day", "mon", "tue", "mon")
            .column("hour", 8, 8, 9)
            .column("value", 1.5, 2, null)
            .build());
        TableTraceBuilder builder = new TableTraceBuilder("heat");

        List<Trace> traces = builder.build(data, List.of(LOAD));

        HeatmapTrace heatmap = (HeatmapTrace) traces.get(0);
        assertThat(heatmap.x).containsExactly("mon", "tue");
        assertThat(heatmap.y).containsExactly(8L, 9L);
        assertThat(heatmap.z).hasSize(2);
        assertThat(heatmap.z.get(0)).containsExactly(1.5, 2L);
        assertThat(heatmap.z.get(1)).containsExactly(null, null);
        assertThat(heatmap.colorscale).isEqualTo("Viridis");
        assertThat(heatmap.reversescale).isTrue();
        assertThat(heatmap.colorbar).containsEntry("title", "Load");

        assertThat(builder.getAnnotations()).extracting(a -> a.text)
            .containsExactly("1.500", "2.000", "", "");
        assertThat(builder.getAnnotations().get(1).x).isEqualTo("tue");
        assertThat(builder.getAnnotations().get(1).y).isEqualTo(8L);
    }

    @Test
    void testDuplicateCell_isConfigurationError() {
        Map<String, IDataSet> data = Map.of("grid", StaticDataSet.builder()
            .column("day", "mon", "mon")
            .column("hour", 8, 8.0)
            .column("value", 1, 2)
            .build());

        assertThatThrownBy(() -> new TableTraceBuilder("heat").build(data, List.of(LOAD)))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("found two values for mon/8");
    }

    @Test
    void testUnknownDatasetIsSkipped() throws Exception {
        TableTraceBuilder builder = new TableTraceBuilder("heat");

        assertThat(builder.build(Map.of(), List.of(LOAD))).isEmpty();
        assertThat(builder.getAnnotations()).isEmpty();
    }

    @Test
    void testCellText() {
        assertThat(LabeledTable.cellText(null)).isEmpty();
        assertThat(LabeledTable.cellText(FieldValue.of(2L / 3.0))).isEqualTo("0.667");
        assertThat(LabeledTable.cellText(FieldValue.text("n/a"))).isEqualTo("n/a");
    }
}
