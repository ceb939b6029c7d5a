package com.dataflow.pipeline.dto.chart;

import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** What one renderer produced for one figure: a PNG (plus optional description) or a failure. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RenderOutcome {
  RenderBackend backend;
  byte[] image;
  Map<String, Object> description;
  String failureReason;

  public static RenderOutcome rendered(
      RenderBackend backend, byte[] image, Map<String, Object> description) {
    return new RenderOutcome(backend, image, description, null);
  }

  public static RenderOutcome failed(RenderBackend backend, String reason) {
    return new RenderOutcome(backend, null, null, reason);
  }

  public boolean isRendered() {
    return image != null;
  }
}
