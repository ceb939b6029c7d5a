package com.dataflow.pipeline.dto.pivot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Canonical pivot representation. The workbook layout and the nested JSON records are both derived
 * from this object. Every cell is present; counts are never negative.
 */
@Value
@Builder
public class PivotTable {

  public static final String INDEX_KEY = "index";
  public static final String COUNT_HEADER = "Count";

  @NonNull String title;

  @NonNull String indexColumn;

  /** Name of the column whose values became the headers; null for frequency tables. */
  String columnAxis;

  @Singular List<String> headers;

  @Singular List<PivotRow> rows;

  public boolean isFrequency() {
    return columnAxis == null;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public long cell(int row, int header) {
    return rows.get(row).getCounts().get(header);
  }

  public long total() {
    long total = 0;
    for (PivotRow row : rows) {
      for (Long count : row.getCounts()) {
        total += count;
      }
    }
    return total;
  }

  /** Row labels in row order. */
  public List<String> indexLabels() {
    List<String> labels = new ArrayList<>(rows.size());
    for (PivotRow row : rows) {
      labels.add(row.getIndexLabel());
    }
    return labels;
  }

  /**
   * One record per index value: {@code "index"} maps to the index label, each header maps to its
   * count. A header literally named "index" overwrites the label.
   */
  public List<Map<String, Object>> toRecords() {
    List<Map<String, Object>> records = new ArrayList<>(rows.size());
    for (PivotRow row : rows) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put(INDEX_KEY, row.getIndexLabel());
      for (int h = 0; h < headers.size(); h++) {
        record.put(headers.get(h), row.getCounts().get(h));
      }
      records.add(record);
    }
    return records;
  }

  /** Rectangular layout: a header line (index column name, then headers) followed by data lines. */
  public List<List<Object>> toGrid() {
    List<List<Object>> grid = new ArrayList<>(rows.size() + 1);
    List<Object> header = new ArrayList<>(headers.size() + 1);
    header.add(indexColumn);
    header.addAll(headers);
    grid.add(header);
    for (PivotRow row : rows) {
      List<Object> line = new ArrayList<>(headers.size() + 1);
      line.add(row.getIndexValue());
      line.addAll(row.getCounts());
      grid.add(line);
    }
    return grid;
  }
}
