package com.dataflow.pipeline.dto.bundle;

import java.util.List;
import java.util.Map;

import com.dataflow.pipeline.dto.analysis.ColumnProfile;
import com.dataflow.pipeline.dto.chart.ChartSpec;
import com.dataflow.pipeline.util.ImmutableCopies;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * Complete, JSON-safe output of one pipeline run. Every value is already in transport form:
 * temporal cells are ISO-8601 text and the workbook travels Base64-encoded. Collections are copied
 * on construction and cannot be modified afterwards.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultBundle {

  @JsonProperty("cleaned_data")
  List<Map<String, Object>> cleanedData;

  @JsonProperty("pivot_tables")
  List<PivotTablePayload> pivotTables;

  @JsonProperty("has_dashboard")
  boolean hasDashboard;

  @JsonProperty("sheets")
  List<String> sheets;

  @JsonProperty("file_content_base64")
  String fileContentBase64;

  /** Hex SHA-256 of the decoded workbook bytes. */
  @JsonProperty("file_content_sha256")
  String fileContentSha256;

  @JsonProperty("file_name")
  String fileName;

  @JsonProperty("requested_relations")
  int requestedRelations;

  @JsonProperty("generated_relations")
  int generatedRelations;

  @JsonProperty("description")
  String description;

  /** Present only when a dashboard was produced. */
  @JsonProperty("charts")
  List<ChartSpec> charts;

  @JsonProperty("column_profiles")
  List<ColumnProfile> columnProfiles;

  @JsonProperty("processing_metadata")
  ProcessingMetadata processingMetadata;

  @Builder
  private ResultBundle(
      List<Map<String, Object>> cleanedData,
      List<PivotTablePayload> pivotTables,
      boolean hasDashboard,
      List<String> sheets,
      String fileContentBase64,
      String fileContentSha256,
      String fileName,
      int requestedRelations,
      int generatedRelations,
      String description,
      List<ChartSpec> charts,
      List<ColumnProfile> columnProfiles,
      ProcessingMetadata processingMetadata) {
    this.cleanedData = ImmutableCopies.records(cleanedData);
    this.pivotTables = ImmutableCopies.list(pivotTables);
    this.hasDashboard = hasDashboard;
    this.sheets = ImmutableCopies.list(sheets);
    this.fileContentBase64 = fileContentBase64;
    this.fileContentSha256 = fileContentSha256;
    this.fileName = fileName;
    this.requestedRelations = requestedRelations;
    this.generatedRelations = generatedRelations;
    this.description = description;
    this.charts = ImmutableCopies.list(charts);
    this.columnProfiles = ImmutableCopies.list(columnProfiles);
    this.processingMetadata = processingMetadata;
  }
}
