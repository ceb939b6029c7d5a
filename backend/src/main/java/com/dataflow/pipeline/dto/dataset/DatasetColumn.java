package com.dataflow.pipeline.dto.dataset;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

@Value
@AllArgsConstructor
public class DatasetColumn {
  @NonNull String name;
  @NonNull ColumnKind kind;

  /** Text column whose values were recognised as dates or times when the file was read. */
  boolean temporalValues;

  public DatasetColumn(String name, ColumnKind kind) {
    this(name, kind, false);
  }
}
