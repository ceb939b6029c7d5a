package com.dataflow.pipeline.dto.chart;

import com.fasterxml.jackson.annotation.JsonValue;

/** Chart kinds in the order they are cycled across relationships. */
public enum ChartKind {
  BAR("bar", "Bar Chart"),
  PIE("pie", "Pie Chart"),
  LINE("line", "Line Chart"),
  HEATMAP("heatmap", "Heatmap"),
  SCATTER("scatter", "Scatter Chart"),
  AREA("area", "Area Chart");

  private final String label;
  private final String titleSuffix;

  ChartKind(String label, String titleSuffix) {
    this.label = label;
    this.titleSuffix = titleSuffix;
  }

  /** Kind for the relationship at the given position: {@code position mod 6} in declaration order. */
  public static ChartKind forPosition(int position) {
    ChartKind[] kinds = values();
    return kinds[Math.floorMod(position, kinds.length)];
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public String getTitleSuffix() {
    return titleSuffix;
  }
}
