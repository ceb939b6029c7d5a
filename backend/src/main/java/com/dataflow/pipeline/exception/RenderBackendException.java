package com.dataflow.pipeline.exception;

import com.dataflow.pipeline.dto.chart.RenderBackend;

import lombok.Getter;

/**
 * Raised inside a chart renderer. Renderers convert it into a failed outcome before returning, so
 * it never escapes chart rendering.
 */
@Getter
public class RenderBackendException extends PipelineException {

  private final RenderBackend backend;

  public RenderBackendException(RenderBackend backend, String message) {
    super(500, message);
    this.backend = backend;
  }

  public RenderBackendException(RenderBackend backend, String message, Throwable cause) {
    super(500, message, cause);
    this.backend = backend;
  }
}
