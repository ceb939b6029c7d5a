package com.dataflow.pipeline.dto.chart;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Renderer-independent chart content. Series charts use {@code categories} and {@code values}
 * (first pivot column on X, second on Y); heatmaps use the full {@code matrix} with row and column
 * labels.
 */
@Value
@Builder
public class ChartFigure {
  ChartKind kind;
  String title;
  String xLabel;
  String yLabel;
  @Singular List<String> categories;
  @Singular List<Long> values;
  @Singular List<String> rowLabels;
  @Singular List<String> columnLabels;
  @Singular("matrixRow") List<List<Long>> matrix;

  public long maxValue() {
    long max = 0;
    if (kind == ChartKind.HEATMAP) {
      for (List<Long> row : matrix) {
        for (Long value : row) {
          max = Math.max(max, value);
        }
      }
    } else {
      for (Long value : values) {
        max = Math.max(max, value);
      }
    }
    return max;
  }
}
