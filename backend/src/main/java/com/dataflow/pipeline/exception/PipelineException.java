package com.dataflow.pipeline.exception;

import lombok.Getter;

/**
 * Base type of every failure the pipeline reports to its caller. The status is the HTTP-equivalent
 * code the surrounding service is expected to answer with.
 */
@Getter
public abstract class PipelineException extends RuntimeException {

  private final int status;

  protected PipelineException(int status, String message) {
    super(message);
    this.status = status;
  }

  protected PipelineException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }
}
