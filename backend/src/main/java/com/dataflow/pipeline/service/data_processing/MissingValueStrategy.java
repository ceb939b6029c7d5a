package com.dataflow.pipeline.service.data_processing;

import com.dataflow.pipeline.dto.dataset.TabularDataset;

/**
 * Decides what happens to cells that are still missing once fully empty rows and columns are gone
 * and empty strings have been turned into missing cells. Every implementation must return a dataset
 * without missing cells.
 */
public interface MissingValueStrategy {

  TabularDataset resolve(TabularDataset dataset);

  Mode mode();

  enum Mode {
    DROP_ROWS,
    IMPUTE
  }

  static MissingValueStrategy forMode(Mode mode) {
    switch (mode) {
      case IMPUTE:
        return new ImputeMissingValuesStrategy();
      case DROP_ROWS:
      default:
        return new DropIncompleteRowsStrategy();
    }
  }
}
