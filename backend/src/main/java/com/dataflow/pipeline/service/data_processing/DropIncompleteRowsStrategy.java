package com.dataflow.pipeline.service.data_processing;

import java.util.ArrayList;
import java.util.List;

import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.util.CellValues;

/** Removes every row that has at least one missing cell. This is the default cleaning contract. */
public class DropIncompleteRowsStrategy implements MissingValueStrategy {

  @Override
  public TabularDataset resolve(TabularDataset dataset) {
    List<List<Object>> kept = new ArrayList<>(dataset.rowCount());
    for (List<Object> row : dataset.getRows()) {
      if (row.stream().noneMatch(CellValues::isMissing)) {
        kept.add(row);
      }
    }
    return new TabularDataset(dataset.getColumns(), kept);
  }

  @Override
  public Mode mode() {
    return Mode.DROP_ROWS;
  }
}
