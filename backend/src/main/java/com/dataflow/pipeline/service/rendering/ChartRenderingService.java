package com.dataflow.pipeline.service.rendering;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.ChartKind;
import com.dataflow.pipeline.dto.chart.ChartSpec;
import com.dataflow.pipeline.dto.chart.RenderBackend;
import com.dataflow.pipeline.dto.chart.RenderOutcome;
import com.dataflow.pipeline.dto.pivot.PivotTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders one chart per pivot. Each chart goes through at most two attempts: the primary renderer,
 * then the secondary one. When both fail the chart is recorded with backend {@code none} and the
 * next pivot is processed as usual.
 */
@Slf4j
@Service
public class ChartRenderingService {

  private final ChartRenderer primaryRenderer;
  private final ChartRenderer secondaryRenderer;
  private final ChartFigureFactory figureFactory;
  private final ChartRenderingConfig config;

  public ChartRenderingService(
      @Qualifier("primaryChartRenderer") ChartRenderer primaryRenderer,
      @Qualifier("secondaryChartRenderer") ChartRenderer secondaryRenderer,
      ChartFigureFactory figureFactory,
      ChartRenderingConfig config) {
    this.primaryRenderer = primaryRenderer;
    this.secondaryRenderer = secondaryRenderer;
    this.figureFactory = figureFactory;
    this.config = config;
  }

  public List<ChartSpec> renderAll(List<PivotTable> pivots) {
    List<ChartSpec> charts = new ArrayList<>(pivots.size());
    int primary = 0;
    int secondary = 0;
    for (int position = 0; position < pivots.size(); position++) {
      ChartSpec chart = render(pivots.get(position), position);
      charts.add(chart);
      if (chart.getBackend() == RenderBackend.PRIMARY) {
        primary++;
      } else if (chart.getBackend() == RenderBackend.SECONDARY) {
        secondary++;
      }
    }
    log.info(
        "Rendered {} chart(s): {} primary, {} secondary, {} without image",
        charts.size(),
        primary,
        secondary,
        charts.size() - primary - secondary);
    return charts;
  }

  public ChartSpec render(PivotTable pivot, int position) {
    ChartKind kind = ChartKind.forPosition(position);
    ChartSpec.ChartSpecBuilder chart =
        ChartSpec.builder().title(pivot.getTitle()).position(position).kind(kind);

    ChartFigure figure;
    try {
      figure = figureFactory.create(pivot, kind);
    } catch (RuntimeException e) {
      log.warn(
          "Could not build {} figure for '{}': {}",
          kind.getLabel(),
          pivot.getTitle(),
          e.getMessage());
      return chart.backend(RenderBackend.NONE).build();
    }

    RenderOutcome outcome = attempt(primaryRenderer, figure);
    if (!outcome.isRendered()) {
      log.warn(
          "Primary renderer failed for '{}' ({}), falling back to secondary",
          figure.getTitle(),
          outcome.getFailureReason());
      outcome = attempt(secondaryRenderer, figure);
      if (!outcome.isRendered()) {
        log.warn(
            "Secondary renderer failed for '{}' ({}), chart skipped",
            figure.getTitle(),
            outcome.getFailureReason());
      }
    }
    log.debug("Chart '{}' resolved with backend {}", figure.getTitle(), outcome.getBackend());

    if (!outcome.isRendered()) {
      return chart.backend(RenderBackend.NONE).build();
    }
    return chart
        .backend(outcome.getBackend())
        .image(outcome.getImage())
        .figure(outcome.getBackend() == RenderBackend.PRIMARY ? outcome.getDescription() : null)
        .build();
  }

  /** Renderers report failures as outcomes; anything they still throw is treated the same way. */
  private RenderOutcome attempt(ChartRenderer renderer, ChartFigure figure) {
    try {
      RenderOutcome outcome = renderer.render(figure, config);
      return outcome != null
          ? outcome
          : RenderOutcome.failed(renderer.backend(), "renderer returned no outcome");
    } catch (RuntimeException e) {
      return RenderOutcome.failed(renderer.backend(), e.getMessage());
    }
  }
}
