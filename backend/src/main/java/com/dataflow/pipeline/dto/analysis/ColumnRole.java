package com.dataflow.pipeline.dto.analysis;

/** How relationship discovery treats a column. */
public enum ColumnRole {
  CATEGORICAL,
  NUMERIC,
  DATETIME_LIKE,
  UNKNOWN
}
