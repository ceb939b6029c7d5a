package com.dataflow.pipeline.dto.pivot;

import java.util.List;

import lombok.Value;

@Value
public class PivotRow {
  /** Original index value, as found in the dataset. */
  Object indexValue;

  String indexLabel;

  /** One count per header, in header order. */
  List<Long> counts;
}
