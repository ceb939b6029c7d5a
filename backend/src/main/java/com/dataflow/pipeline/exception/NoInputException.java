package com.dataflow.pipeline.exception;

/** No source file is available at the requested location. */
public class NoInputException extends PipelineException {

  public NoInputException(String message) {
    super(400, message);
  }
}
