package com.dataflow.pipeline.service.data_processing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.util.CellValues;

/**
 * Keeps partial rows and fills their gaps column by column: numeric columns with the median of the
 * present values, every other column with its most frequent value (first seen wins a tie). A column
 * with no present value at all has nothing to fill from and is dropped.
 */
public class ImputeMissingValuesStrategy implements MissingValueStrategy {

  @Override
  public TabularDataset resolve(TabularDataset dataset) {
    int width = dataset.columnCount();
    Object[] fills = new Object[width];
    for (int c = 0; c < width; c++) {
      DatasetColumn column = dataset.getColumns().get(c);
      List<Object> values = dataset.columnValues(c);
      fills[c] = column.getKind() == ColumnKind.NUMERIC ? median(values) : mode(values);
    }

    List<Integer> keep = new ArrayList<>(width);
    List<DatasetColumn> columns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      if (fills[c] != null) {
        keep.add(c);
        columns.add(dataset.getColumns().get(c));
      }
    }

    List<List<Object>> rows = new ArrayList<>(dataset.rowCount());
    for (List<Object> row : dataset.getRows()) {
      List<Object> filled = new ArrayList<>(keep.size());
      for (int c : keep) {
        Object value = row.get(c);
        filled.add(CellValues.isMissing(value) ? fills[c] : value);
      }
      rows.add(filled);
    }
    return new TabularDataset(columns, rows);
  }

  @Override
  public Mode mode() {
    return Mode.IMPUTE;
  }

  private Object median(List<Object> values) {
    List<Double> numbers = new ArrayList<>();
    boolean integral = true;
    for (Object value : values) {
      if (value instanceof Number) {
        numbers.add(((Number) value).doubleValue());
        integral &= value instanceof Long || value instanceof Integer;
      }
    }
    if (numbers.isEmpty()) {
      return mode(values);
    }
    numbers.sort(Double::compare);
    int mid = numbers.size() / 2;
    double median =
        numbers.size() % 2 == 1 ? numbers.get(mid) : (numbers.get(mid - 1) + numbers.get(mid)) / 2;
    if (integral && median == Math.rint(median)) {
      return (long) median;
    }
    return median;
  }

  private Object mode(List<Object> values) {
    Map<Object, Integer> counts = new LinkedHashMap<>();
    for (Object value : values) {
      if (!CellValues.isMissing(value)) {
        counts.merge(value, 1, Integer::sum);
      }
    }
    Object best = null;
    int bestCount = 0;
    for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }
}
