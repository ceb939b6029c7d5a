package com.dataflow.pipeline.service.rendering;

import java.awt.AWTError;
import java.io.IOException;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.RenderOutcome;
import com.dataflow.pipeline.exception.RenderBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns every way a backend can fail into a failed {@link RenderOutcome}. A missing display,
 * missing fonts or native graphics libraries surface as errors rather than exceptions, so those are
 * converted too.
 */
@Slf4j
public abstract class AbstractChartRenderer implements ChartRenderer {

  @Override
  public final RenderOutcome render(ChartFigure figure, ChartRenderingConfig config) {
    if (!isEnabled(config)) {
      return RenderOutcome.failed(backend(), backend().getLabel() + " renderer is disabled");
    }
    try {
      return draw(figure, config);
    } catch (RenderBackendException e) {
      return failure(figure, e.getMessage(), e);
    } catch (IOException | RuntimeException | LinkageError | AWTError | InternalError e) {
      return failure(figure, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  protected abstract boolean isEnabled(ChartRenderingConfig config);

  protected abstract RenderOutcome draw(ChartFigure figure, ChartRenderingConfig config)
      throws IOException;

  private RenderOutcome failure(ChartFigure figure, String reason, Throwable cause) {
    log.debug("{} renderer failed on '{}'", backend().getLabel(), figure.getTitle(), cause);
    return RenderOutcome.failed(backend(), reason);
  }
}
