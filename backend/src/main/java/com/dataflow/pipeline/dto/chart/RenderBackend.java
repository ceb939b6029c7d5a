package com.dataflow.pipeline.dto.chart;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RenderBackend {
  PRIMARY,
  SECONDARY,
  NONE;

  @JsonValue
  public String getLabel() {
    return name().toLowerCase(Locale.ROOT);
  }
}
