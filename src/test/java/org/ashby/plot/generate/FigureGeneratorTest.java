package org.ashby.plot.generate;

import java.time.Instant;
import java.util.Map;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.GenerationCancelledException;
import org.ashby.plot.api.PlotConfigurationException;
import org.ashby.plot.data.DataSourceRegistry;
import org.ashby.plot.data.StaticDataSet;
import org.ashby.plot.definition.PlotDefinition;
import org.ashby.plot.definition.PlotDefinitionParser;
import org.ashby.plot.figure.BarTrace;
import org.ashby.plot.figure.FigureDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of figure generation from parsed definitions against fixture datasets.
 */
@Tag("unit")
class FigureGeneratorTest {

    private static final Instant BASIS = Instant.parse("2024-05-06T12:00:00Z");

    private final PlotDefinitionParser parser = new PlotDefinitionParser();
    private final FigureGenerator generator = new FigureGenerator();
    private DataSourceRegistry sources;

    @BeforeEach
    void setUp() {
        sources = new DataSourceRegistry();
        sources.getStaticSource()
            .register("this_week", StaticDataSet.builder().column("team", "red", "blue").column("score", 10, 7).build())
            .register("last_week", StaticDataSet.builder().column("team", "blue", "red").column("score", 9, 4).build());
    }

    @AfterEach
    void tearDown() {
        sources.close();
    }

    private FigureDocument generate(String yaml) throws Exception {
        PlotDefinition def = parser.parse("scores.yaml", yaml);
        return generator.generate(def, new PlotContext(BASIS, sources, Map.of("team", "all"), null));
    }

    @Test
    void testComputedDatasetFeedsSeries() throws Exception {
        FigureDocument doc = generate("""
            frequency: daily
            datasets:
              - {name: now, source: static, query: this_week}
              - {name: before, source: static, query: last_week}
            computed:
              - name: change
                function: diff
                datasets:
                  - {dataset: now, joinField: team, valueField: score}
                  - {dataset: before, joinField: team, valueField: score}
            series:
              - {type: bar, name: Change, dataset: change, labels: key, values: value}
            """);

        BarTrace bar = (BarTrace) doc.data.get(0);
        assertThat(bar.x).containsExactly("red", "blue");
        assertThat(bar.y).containsExactly(6L, -2L);
    }

    @Test
    void testUnknownSeriesDatasetIsSkippedAndRestRenders() throws Exception {
        FigureDocument doc = generate("""
            datasets:
              - {name: now, source: static, query: this_week}
            series:
              - {type: bar, name: Ghost, dataset: nope, labels: team, values: score}
              - {type: line, name: Score, dataset: now, labels: team, values: score}
            scalars:
              - {type: number, name: Missing, dataset: nope, value: score}
            """);

        assertThat(doc.data).extracting(t -> t.name).containsExactly("Score");
    }

    @Test
    void testDocumentShape() throws Exception {
        FigureDocument doc = generate("""
            datasets:
              - {name: grid, source: demo, query: populations}
            tables:
              - {type: heatmap, name: Pop, dataset: grid, labelsX: creature, labelsY: month1, values: month2}
            layout:
              title: {text: Populations}
            config:
              displayModeBar: false
            """);

        JsonObject json = JsonParser.parseString(doc.toJson(true)).getAsJsonObject();
        assertThat(json.keySet()).containsExactly("data", "layout", "config", "params");
        assertThat(json.getAsJsonArray("data").get(0).getAsJsonObject().get("type").getAsString()).isEqualTo("heatmap");
        assertThat(json.getAsJsonObject("layout").getAsJsonArray("annotations")).hasSize(9);
        assertThat(json.getAsJsonObject("layout").getAsJsonObject("title").get("text").getAsString())
            .isEqualTo("Populations");
        assertThat(json.getAsJsonObject("config").get("displayModeBar").getAsBoolean()).isFalse();
        assertThat(json.getAsJsonObject("params").get("team").getAsString()).isEqualTo("all");
        assertThat(doc.toJson(true)).doesNotContain("\n");
        assertThat(doc.toJson(false)).contains("\n");
    }

    @Test
    void testNonFiniteFloatsSerializeAsNull() throws Exception {
        sources.getStaticSource().register("ratios",
            StaticDataSet.builder().column("team", "red", "blue").column("ratio", Double.NaN, 1.5).build());

        FigureDocument doc = generate("""
            datasets:
              - {name: r, source: static, query: ratios}
            series:
              - {type: line, name: Ratio, dataset: r, labels: team, values: ratio}
            scalars:
              - {type: number, name: First, dataset: r, value: ratio}
            """);

        JsonObject json = JsonParser.parseString(doc.toJson(true)).getAsJsonObject();
        assertThat(json.getAsJsonArray("data")).hasSize(1);
        JsonObject line = json.getAsJsonArray("data").get(0).getAsJsonObject();
        assertThat(line.getAsJsonArray("y").get(0).isJsonNull()).isTrue();
        assertThat(line.getAsJsonArray("y").get(1).getAsDouble()).isEqualTo(1.5);
    }

    @Test
    void testDefinitionParametersWinOverTemplateParams() throws Exception {
        FigureDocument doc = generate("""
            parameters:
              team: red
            """);

        assertThat(doc.params).containsEntry("team", "red");
        assertThat(doc.layout).doesNotContainKey("annotations");
    }

    @Test
    void testUnknownSource_isConfigurationError() {
        assertThatThrownBy(() -> generate("""
            datasets:
              - {name: x, source: warehouse, query: q}
            """))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("warehouse");
    }

    @Test
    void testDuplicateDatasetName_isConfigurationError() {
        assertThatThrownBy(() -> generate("""
            datasets:
              - {name: x, source: static, query: this_week}
              - {name: x, source: static, query: last_week}
            """))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("duplicate dataset");
    }

    @Test
    void testFailedFetch_isDataAccessErrorNamingDataset() {
        assertThatThrownBy(() -> generate("""
            datasets:
              - {name: x, source: static, query: not_registered}
            """))
            .isInstanceOf(DataAccessException.class)
            .hasMessageContaining("\"x\"");
    }

    @Test
    void testComputedWithOneInput_isConfigurationError() {
        assertThatThrownBy(() -> generate("""
            datasets:
              - {name: now, source: static, query: this_week}
            computed:
              - name: change
                function: diff
                datasets:
                  - {dataset: now, joinField: team, valueField: score}
            """))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("change");
    }

    @Test
    void testComputedNameClash_isConfigurationError() {
        assertThatThrownBy(() -> generate("""
            datasets:
              - {name: now, source: static, query: this_week}
            computed:
              - name: now
                function: diff
                datasets:
                  - {dataset: now, joinField: team, valueField: score}
                  - {dataset: now, joinField: team, valueField: score}
            """))
            .isInstanceOf(PlotConfigurationException.class)
            .hasMessageContaining("conflicts");
    }

    @Test
    void testCancelledToken_stopsBeforeFetching() throws Exception {
        PlotDefinition def = parser.parse("scores.yaml", """
            datasets:
              - {name: now, source: static, query: this_week}
            """);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> generator.generate(def, new PlotContext(BASIS, sources, null, null), token))
            .isInstanceOf(GenerationCancelledException.class)
            .hasMessageContaining("scores");
    }

    @Test
    void testOutputIsDeterministic() throws Exception {
        String yaml = """
            datasets:
              - {name: now, source: static, query: this_week}
            series:
              - {type: line, name: s, dataset: now, labels: team, values: score, groupfield: team, groupvalue: "*"}
            """;

        assertThat(generate(yaml).toJson(false)).isEqualTo(generate(yaml).toJson(false));
        assertThat(generate(yaml).data).extracting(t -> t.name).containsExactly("s-blue", "s-red");
    }

    @Test
    void testUnusedListsAreEmpty() throws Exception {
        FigureDocument doc = generate("name: empty\n");

        assertThat(doc.data).isEmpty();
        assertThat(doc.layout).isEmpty();
        assertThat(doc.config).isEmpty();
    }
}
