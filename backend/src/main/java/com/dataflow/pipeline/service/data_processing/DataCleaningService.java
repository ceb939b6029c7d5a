package com.dataflow.pipeline.service.data_processing;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.dto.cleaning.CleaningPolicy;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.util.CellValues;

import lombok.extern.slf4j.Slf4j;

/**
 * Produces a dense dataset: fully empty rows and columns go first, empty strings become missing
 * cells, the policy's missing-value strategy resolves the rest, and finally the requested columns
 * are dropped. A dataset with zero rows is a valid result.
 */
@Slf4j
@Service
public class DataCleaningService {

  public TabularDataset clean(TabularDataset dataset, CleaningPolicy policy) {
    int loadedRows = dataset.rowCount();
    int loadedColumns = dataset.columnCount();

    TabularDataset current = dropFullyEmptyRows(dataset);
    current = dropFullyEmptyColumns(current);
    current = emptyTextToMissing(current);
    current = policy.getMissingValueStrategy().resolve(current);
    current = dropColumns(current, policy);

    log.info(
        "Cleaned dataset: {} -> {} rows, {} -> {} columns (missing values: {})",
        loadedRows,
        current.rowCount(),
        loadedColumns,
        current.columnCount(),
        policy.getMissingValueStrategy().mode());
    return current;
  }

  TabularDataset dropFullyEmptyRows(TabularDataset dataset) {
    List<List<Object>> kept = new ArrayList<>(dataset.rowCount());
    for (List<Object> row : dataset.getRows()) {
      if (!row.stream().allMatch(CellValues::isMissing)) {
        kept.add(row);
      }
    }
    return new TabularDataset(dataset.getColumns(), kept);
  }

  /** A column without a single present value is dropped, including every column of a zero-row table. */
  TabularDataset dropFullyEmptyColumns(TabularDataset dataset) {
    List<Integer> keep = new ArrayList<>();
    for (int c = 0; c < dataset.columnCount(); c++) {
      if (!dataset.columnValues(c).stream().allMatch(CellValues::isMissing)) {
        keep.add(c);
      } else {
        log.debug("Dropping empty column '{}'", dataset.getColumns().get(c).getName());
      }
    }
    return project(dataset, keep);
  }

  TabularDataset emptyTextToMissing(TabularDataset dataset) {
    List<List<Object>> rows = new ArrayList<>(dataset.rowCount());
    for (List<Object> row : dataset.getRows()) {
      List<Object> converted = new ArrayList<>(row.size());
      for (Object value : row) {
        converted.add(CellValues.isEmptyText(value) ? null : value);
      }
      rows.add(converted);
    }
    return new TabularDataset(dataset.getColumns(), rows);
  }

  TabularDataset dropColumns(TabularDataset dataset, CleaningPolicy policy) {
    if (policy.getColumnsToRemove().isEmpty()) {
      return dataset;
    }
    List<Integer> keep = new ArrayList<>();
    for (int c = 0; c < dataset.columnCount(); c++) {
      if (!policy.getColumnsToRemove().contains(dataset.getColumns().get(c).getName())) {
        keep.add(c);
      }
    }
    return project(dataset, keep);
  }

  private TabularDataset project(TabularDataset dataset, List<Integer> keep) {
    if (keep.size() == dataset.columnCount()) {
      return dataset;
    }
    List<DatasetColumn> columns = new ArrayList<>(keep.size());
    for (int index : keep) {
      columns.add(dataset.getColumns().get(index));
    }
    List<List<Object>> rows = new ArrayList<>(dataset.rowCount());
    for (List<Object> row : dataset.getRows()) {
      List<Object> projected = new ArrayList<>(keep.size());
      for (int index : keep) {
        projected.add(row.get(index));
      }
      rows.add(projected);
    }
    return new TabularDataset(columns, rows);
  }
}
