package com.dataflow.pipeline.exception;

import java.time.Duration;

import lombok.Getter;

/** The caller-imposed deadline elapsed before the pipeline finished. Never retried here. */
@Getter
public class ProcessingTimeoutException extends PipelineException {

  private final Duration deadline;

  public ProcessingTimeoutException(Duration deadline) {
    super(504, "Processing did not finish within " + deadline.toMillis() + " ms");
    this.deadline = deadline;
  }
}
