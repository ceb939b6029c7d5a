package com.dataflow.pipeline.dto.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;

/**
 * Rectangular table of named, typed columns. Rows are stored row-major; a missing cell is {@code
 * null}. Instances are immutable: every cleaning step produces a new dataset.
 */
@EqualsAndHashCode
public final class TabularDataset {

  private final List<DatasetColumn> columns;
  private final List<List<Object>> rows;

  public TabularDataset(List<DatasetColumn> columns, List<List<Object>> rows) {
    this.columns = List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row.size() != columns.size()) {
        throw new IllegalArgumentException(
            "Row width " + row.size() + " does not match column count " + columns.size());
      }
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public List<DatasetColumn> getColumns() {
    return columns;
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (DatasetColumn column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Returns the position of the named column, or -1 when absent. */
  public int indexOf(String columnName) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getName().equals(columnName)) {
        return i;
      }
    }
    return -1;
  }

  public DatasetColumn column(String columnName) {
    int index = indexOf(columnName);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown column: " + columnName);
    }
    return columns.get(index);
  }

  public List<Object> columnValues(int columnIndex) {
    List<Object> values = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      values.add(row.get(columnIndex));
    }
    return values;
  }

  /** One insertion-ordered record per row, keyed by column name. */
  public List<Map<String, Object>> toRecords() {
    List<Map<String, Object>> records = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      Map<String, Object> record = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        record.put(columns.get(i).getName(), row.get(i));
      }
      records.add(record);
    }
    return records;
  }

  @Override
  public String toString() {
    return "TabularDataset[columns=" + getColumnNames() + ", rows=" + rows.size() + "]";
  }
}
