package com.dataflow.pipeline.dto.analysis;

import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class ColumnProfile {

  @JsonProperty("name")
  String name;

  @JsonProperty("kind")
  ColumnKind kind;

  @JsonProperty("role")
  ColumnRole role;

  /** Declared DATETIME, date-valued text, or a name containing "date" or "time" in any case. */
  @JsonProperty("datetime_like")
  boolean datetimeLike;

  @JsonProperty("distinct_values")
  int distinctValues;
}
