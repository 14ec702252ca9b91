package com.lucidata.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Chart renderer")
class ChartRendererTest {

    private final ChartRenderer renderer = new ChartRenderer();

    private static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }

    private static final List<String> COLUMNS = List.of("model", "hp", "mpg");
    private static final List<Map<String, Object>> CARS = List.of(
            row("model", "Mazda RX4", "hp", 110, "mpg", 21.0),
            row("model", "Datsun 710", "hp", 93, "mpg", 22.8),
            row("model", "Valiant", "hp", 105, "mpg", null));

    @Test
    @DisplayName("Bar charts use the first column as labels and the second as values")
    void barWithLabels() {
        ChartRenderer.ChartPlan plan = renderer.plan(COLUMNS, CARS, "bar", "Power");

        assertThat(plan.kind()).isEqualTo(ChartRenderer.ChartKind.BAR);
        assertThat(plan.labels()).containsExactly("Mazda RX4", "Datsun 710", "Valiant");
        assertThat(plan.series()).hasSize(1);
        assertThat(plan.series().get(0).name()).isEqualTo("hp");
        assertThat(plan.series().get(0).values()).containsExactly(110.0, 93.0, 105.0);
        assertThat(plan.title()).isEqualTo("Power");
    }

    @Test
    @DisplayName("Single-column bar charts are indexed by row")
    void barSingleColumn() {
        ChartRenderer.ChartPlan plan = renderer.plan(List.of("hp"), List.of(row("hp", 110), row("hp", 93)), "BAR", null);

        assertThat(plan.kind()).isEqualTo(ChartRenderer.ChartKind.BAR);
        assertThat(plan.labels()).containsExactly("0", "1");
        assertThat(plan.series().get(0).values()).containsExactly(110.0, 93.0);
    }

    @Test
    @DisplayName("Line charts draw every numeric column")
    void line() {
        ChartRenderer.ChartPlan plan = renderer.plan(COLUMNS, CARS, "line", null);

        assertThat(plan.kind()).isEqualTo(ChartRenderer.ChartKind.LINE);
        assertThat(plan.series()).extracting(ChartRenderer.Series::name).containsExactly("hp", "mpg");
        assertThat(plan.series().get(1).values().get(2)).isNaN();
    }

    @Test
    @DisplayName("Pie charts need two columns")
    void pie() {
        assertThat(renderer.plan(COLUMNS, CARS, "pie", null).kind()).isEqualTo(ChartRenderer.ChartKind.PIE);

        ChartRenderer.ChartPlan single = renderer.plan(List.of("hp"), List.of(row("hp", 110)), "pie", null);
        assertThat(single.kind()).isEqualTo(ChartRenderer.ChartKind.BAR);
    }

    @Test
    @DisplayName("Unknown chart types become a bar of the first numeric column")
    void unknownType() {
        ChartRenderer.ChartPlan plan = renderer.plan(COLUMNS, CARS, "scatter", null);

        assertThat(plan.kind()).isEqualTo(ChartRenderer.ChartKind.BAR);
        assertThat(plan.series().get(0).name()).isEqualTo("hp");
        assertThat(plan.labels()).containsExactly("0", "1", "2");
    }

    @Test
    @DisplayName("Nothing is drawn without numeric data")
    void noNumericData() {
        List<Map<String, Object>> rows = List.of(row("model", "Mazda RX4", "origin", "JP"));

        assertThat(renderer.plan(List.of("model", "origin"), rows, "bar", null)).isNull();
        assertThat(renderer.render(List.of("model", "origin"), rows, "bar", null)).isNull();
        assertThat(renderer.render(List.of(), List.of(), "bar", null)).isNull();
    }

    @Test
    @DisplayName("Nothing is drawn when the value column is not numeric")
    void nonNumericValueColumn() {
        List<Map<String, Object>> rows = List.of(row("hp", 110, "model", "Mazda RX4"));

        assertThat(renderer.plan(List.of("hp", "model"), rows, "pie", null)).isNull();
    }

    @Test
    @DisplayName("Produces a PNG data URI or nothing")
    void render() {
        String uri = renderer.render(COLUMNS, CARS, "bar", "Power");

        // null when the runtime cannot draw (no fonts); never an exception
        if (uri != null) {
            assertThat(uri).startsWith("data:image/png;base64,");
            assertThat(uri.length()).isGreaterThan("data:image/png;base64,".length());
        }
    }
}
