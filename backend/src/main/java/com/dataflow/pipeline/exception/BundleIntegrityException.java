package com.dataflow.pipeline.exception;

/** A transported workbook does not match its recorded content address. */
public class BundleIntegrityException extends PipelineException {

  public BundleIntegrityException(String message) {
    super(400, message);
  }
}
