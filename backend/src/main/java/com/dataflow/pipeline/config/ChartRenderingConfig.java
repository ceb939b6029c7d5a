package com.dataflow.pipeline.config;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/** Immutable rendering settings handed to every chart renderer. */
@Value
@Builder
public class ChartRenderingConfig {
  @Builder.Default int width = 600;
  @Builder.Default int height = 400;
  @Builder.Default boolean primaryEnabled = true;
  @Builder.Default boolean secondaryEnabled = true;

  /** Where rasterized images are written before embedding; null means the system temp directory. */
  Path scratchDirectory;

  public static ChartRenderingConfig defaults() {
    return ChartRenderingConfig.builder().build();
  }
}
