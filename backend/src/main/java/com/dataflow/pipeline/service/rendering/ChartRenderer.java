package com.dataflow.pipeline.service.rendering;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.RenderBackend;
import com.dataflow.pipeline.dto.chart.RenderOutcome;

/** One rendering backend. Implementations report failure through the outcome, never by throwing. */
public interface ChartRenderer {

  RenderBackend backend();

  RenderOutcome render(ChartFigure figure, ChartRenderingConfig config);
}
