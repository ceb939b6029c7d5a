package com.dataflow.pipeline.config;

import lombok.Builder;
import lombok.Value;

/**
 * Placement of chart images on the dashboard sheet, in 1-based spreadsheet coordinates. Two charts
 * share a row band; the band advances by {@code rowSpacing} rows.
 */
@Value
@Builder
public class DashboardLayout {
  @Builder.Default String title = "Dashboard - Auto Generated";
  @Builder.Default int rowStart = 5;
  @Builder.Default int rowSpacing = 25;
  @Builder.Default int columnStart = 2;
  @Builder.Default int columnSpacing = 10;

  public static DashboardLayout defaults() {
    return DashboardLayout.builder().build();
  }

  /** 1-based anchor row of the chart at the given position among embedded charts. */
  public int anchorRow(int position) {
    return rowStart + (position / 2) * rowSpacing;
  }

  /** 1-based anchor column of the chart at the given position among embedded charts. */
  public int anchorColumn(int position) {
    return columnStart + (position % 2) * columnSpacing;
  }
}
