package com.dataflow.pipeline.exception;

/** Cleaning left neither a categorical nor a numeric column to summarize. */
public class NoUsableColumnsException extends PipelineException {

  public NoUsableColumnsException(String message) {
    super(400, message);
  }
}
