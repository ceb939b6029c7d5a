package com.dataflow.pipeline.exception;

import lombok.Getter;

@Getter
public class UnsupportedFormatException extends PipelineException {

  private final String extension;

  public UnsupportedFormatException(String extension) {
    super(
        400,
        "Unsupported file format: '"
            + extension
            + "'. Please upload an Excel (.xlsx, .xls) or CSV file.");
    this.extension = extension;
  }
}
