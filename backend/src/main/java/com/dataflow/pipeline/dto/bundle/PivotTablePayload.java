package com.dataflow.pipeline.dto.bundle;

import java.util.List;
import java.util.Map;

import com.dataflow.pipeline.util.ImmutableCopies;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Nested-record view of a pivot table, as consumed by the front end. */
@Value
public class PivotTablePayload {

  @JsonProperty("title")
  String title;

  @JsonProperty("index_column")
  String indexColumn;

  @JsonProperty("column_headers")
  List<String> columnHeaders;

  @JsonProperty("data")
  List<Map<String, Object>> data;

  @Builder
  private PivotTablePayload(
      String title,
      String indexColumn,
      List<String> columnHeaders,
      List<Map<String, Object>> data) {
    this.title = title;
    this.indexColumn = indexColumn;
    this.columnHeaders = ImmutableCopies.list(columnHeaders);
    this.data = ImmutableCopies.records(data);
  }
}
