package com.dataflow.pipeline.exception;

public class WorkbookAssemblyException extends PipelineException {

  public WorkbookAssemblyException(String message, Throwable cause) {
    super(500, message, cause);
  }
}
