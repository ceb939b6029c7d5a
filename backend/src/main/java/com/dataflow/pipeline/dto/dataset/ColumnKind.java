package com.dataflow.pipeline.dto.dataset;

/** Value kind declared for a column when the source file is loaded. Never re-derived later. */
public enum ColumnKind {
  NUMERIC,
  TEXT,
  DATETIME,
  UNKNOWN
}
