package com.dataflow.pipeline.service.rendering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.ChartKind;
import com.dataflow.pipeline.dto.pivot.PivotRow;
import com.dataflow.pipeline.dto.pivot.PivotTable;

/** Maps a pivot onto a chart figure and describes figures as data/layout JSON trees. */
@Component
public class ChartFigureFactory {

  /**
   * Series kinds read the pivot with its index reset into the first column: index labels on X,
   * the first header's counts on Y. Heatmaps take the whole matrix.
   */
  public ChartFigure create(PivotTable pivot, ChartKind kind) {
    ChartFigure.ChartFigureBuilder figure =
        ChartFigure.builder().kind(kind).title(pivot.getTitle() + " " + kind.getTitleSuffix());

    if (kind == ChartKind.HEATMAP) {
      figure
          .xLabel(pivot.getColumnAxis() != null ? pivot.getColumnAxis() : "")
          .yLabel(pivot.getIndexColumn())
          .columnLabels(pivot.getHeaders())
          .rowLabels(pivot.indexLabels());
      for (PivotRow row : pivot.getRows()) {
        figure.matrixRow(row.getCounts());
      }
      return figure.build();
    }

    figure
        .xLabel(pivot.getIndexColumn())
        .yLabel(pivot.getHeaders().isEmpty() ? PivotTable.COUNT_HEADER : pivot.getHeaders().get(0));
    if (!pivot.getHeaders().isEmpty()) {
      for (PivotRow row : pivot.getRows()) {
        figure.category(row.getIndexLabel()).value(row.getCounts().get(0));
      }
    }
    return figure.build();
  }

  public Map<String, Object> describe(ChartFigure figure, ChartRenderingConfig config) {
    Map<String, Object> trace = new LinkedHashMap<>();
    switch (figure.getKind()) {
      case PIE:
        trace.put("type", "pie");
        trace.put("labels", figure.getCategories());
        trace.put("values", figure.getValues());
        break;
      case HEATMAP:
        trace.put("type", "heatmap");
        trace.put("x", figure.getColumnLabels());
        trace.put("y", figure.getRowLabels());
        trace.put("z", figure.getMatrix());
        trace.put("colorbar", Map.of("title", Map.of("text", PivotTable.COUNT_HEADER)));
        break;
      case LINE:
        putSeries(trace, figure, "scatter");
        trace.put("mode", "lines");
        break;
      case SCATTER:
        putSeries(trace, figure, "scatter");
        trace.put("mode", "markers");
        break;
      case AREA:
        putSeries(trace, figure, "scatter");
        trace.put("mode", "lines");
        trace.put("fill", "tozeroy");
        break;
      case BAR:
      default:
        putSeries(trace, figure, "bar");
        break;
    }

    Map<String, Object> layout = new LinkedHashMap<>();
    layout.put("title", Map.of("text", figure.getTitle()));
    layout.put("width", config.getWidth());
    layout.put("height", config.getHeight());
    if (figure.getKind() != ChartKind.PIE) {
      layout.put("xaxis", Map.of("title", Map.of("text", figure.getXLabel())));
      layout.put("yaxis", Map.of("title", Map.of("text", figure.getYLabel())));
    }

    List<Object> data = new ArrayList<>();
    data.add(trace);
    Map<String, Object> description = new LinkedHashMap<>();
    description.put("data", data);
    description.put("layout", layout);
    return description;
  }

  private void putSeries(Map<String, Object> trace, ChartFigure figure, String type) {
    trace.put("type", type);
    trace.put("name", figure.getYLabel());
    trace.put("x", figure.getCategories());
    trace.put("y", figure.getValues());
  }
}
