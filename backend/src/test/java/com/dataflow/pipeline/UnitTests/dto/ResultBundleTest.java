package com.dataflow.pipeline.UnitTests.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.dataflow.pipeline.dto.bundle.PivotTablePayload;
import com.dataflow.pipeline.dto.bundle.ResultBundle;
import com.dataflow.pipeline.dto.chart.ChartKind;
import com.dataflow.pipeline.dto.chart.ChartSpec;
import com.dataflow.pipeline.dto.chart.RenderBackend;
import com.dataflow.pipeline.fixtures.TestFixtures;

class ResultBundleTest {

  private static Map<String, Object> record(String key, Object value) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(key, value);
    return record;
  }

  @Test
  void shouldRejectChangesToCollectionsAfterBuild() {
    List<Map<String, Object>> cleaned = new ArrayList<>(List.of(record("region", "North")));
    ResultBundle bundle =
        ResultBundle.builder()
            .cleanedData(cleaned)
            .sheets(new ArrayList<>(List.of("CleanedData")))
            .pivotTables(new ArrayList<>())
            .build();

    assertThatThrownBy(() -> bundle.getCleanedData().add(Map.of()))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> bundle.getCleanedData().get(0).put("region", "South"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> bundle.getSheets().clear())
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> bundle.getPivotTables().add(null))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldNotSeeLaterChangesToBuilderInputs() {
    Map<String, Object> row = record("region", "North");
    List<Map<String, Object>> cleaned = new ArrayList<>(List.of(row));
    ResultBundle bundle = ResultBundle.builder().cleanedData(cleaned).build();

    cleaned.add(record("region", "East"));
    row.put("region", "West");

    assertThat(bundle.getCleanedData()).hasSize(1);
    assertThat(bundle.getCleanedData().get(0)).containsEntry("region", "North");
  }

  @Test
  void shouldKeepMissingValuesInRecords() {
    ResultBundle bundle =
        ResultBundle.builder().cleanedData(List.of(record("score", null))).build();

    assertThat(bundle.getCleanedData().get(0)).containsEntry("score", null);
  }

  @Test
  void shouldFreezePivotPayloadRecords() {
    PivotTablePayload payload =
        PivotTablePayload.builder()
            .title("team Frequency")
            .indexColumn("team")
            .columnHeaders(new ArrayList<>(List.of("Count")))
            .data(new ArrayList<>(List.of(record("team", "red"))))
            .build();

    assertThatThrownBy(() -> payload.getData().get(0).put("Count", 9L))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> payload.getColumnHeaders().add("Extra"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldHandOutCopiesOfChartImageAndFigure() {
    byte[] png = TestFixtures.tinyPng();
    Map<String, Object> layout = record("width", 600);
    ChartSpec chart =
        ChartSpec.builder()
            .title("team Frequency Bar Chart")
            .kind(ChartKind.BAR)
            .backend(RenderBackend.PRIMARY)
            .image(png)
            .figure(record("layout", layout))
            .build();

    png[0] = 0;
    chart.getImage()[1] = 0;
    layout.put("width", 1);

    assertThat(chart.getImage()).isEqualTo(TestFixtures.tinyPng());
    assertThat(chart.getFigure().get("layout")).isEqualTo(Map.of("width", 600));
    assertThatThrownBy(() -> chart.getFigure().put("data", List.of()))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
