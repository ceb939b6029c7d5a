package com.dataflow.pipeline.exception;

/** The source file exists and has a supported extension but could not be parsed. */
public class DatasetReadException extends PipelineException {

  public DatasetReadException(String message) {
    super(400, message);
  }

  public DatasetReadException(String message, Throwable cause) {
    super(400, message, cause);
  }
}
