package com.dataflow.pipeline.dto.chart;

import java.util.Map;

import com.dataflow.pipeline.util.ImmutableCopies;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Rendering result for one relationship. The image and figure are copied in and out. */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChartSpec {

  @JsonProperty("title")
  String title;

  @JsonProperty("position")
  int position;

  @JsonProperty("kind")
  ChartKind kind;

  @JsonProperty("backend")
  RenderBackend backend;

  /** PNG bytes; absent when backend is NONE. Travels inside the workbook, not the JSON. */
  @JsonIgnore byte[] image;

  /** Re-renderable figure description; only the primary renderer provides one. */
  @JsonProperty("figure")
  Map<String, Object> figure;

  @Builder
  private ChartSpec(
      String title,
      int position,
      ChartKind kind,
      RenderBackend backend,
      byte[] image,
      Map<String, Object> figure) {
    this.title = title;
    this.position = position;
    this.kind = kind;
    this.backend = backend;
    this.image = image == null ? null : image.clone();
    this.figure = ImmutableCopies.tree(figure);
  }

  public byte[] getImage() {
    return image == null ? null : image.clone();
  }

  @JsonIgnore
  public boolean hasImage() {
    return image != null;
  }
}
