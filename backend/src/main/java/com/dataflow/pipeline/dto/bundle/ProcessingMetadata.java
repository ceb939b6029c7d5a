package com.dataflow.pipeline.dto.bundle;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProcessingMetadata {

  @JsonProperty("rows_loaded")
  int rowsLoaded;

  @JsonProperty("rows_after_cleaning")
  int rowsAfterCleaning;

  @JsonProperty("columns_removed")
  int columnsRemoved;

  @JsonProperty("charts_embedded")
  int chartsEmbedded;

  @JsonProperty("processing_time_ms")
  long processingTimeMs;
}
