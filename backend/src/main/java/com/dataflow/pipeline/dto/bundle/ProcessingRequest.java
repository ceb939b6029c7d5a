package com.dataflow.pipeline.dto.bundle;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs of one pipeline run, as handed over by the upload layer.
 */
@Value
@Builder
public class ProcessingRequest {

  /** Uploaded file, or the directory holding it. */
  Path sourcePath;

  /** Comma-separated column names to drop; may be blank. */
  @Builder.Default String removeFields = "";

  /** Values below 1 are treated as 1. */
  @Builder.Default int requestedRelations = 1;

  @Builder.Default boolean requireDashboard = false;

  /** Passed through to the bundle untouched. */
  String description;

  /** Name of the produced workbook; generated when null or blank. */
  String outputFileName;
}
