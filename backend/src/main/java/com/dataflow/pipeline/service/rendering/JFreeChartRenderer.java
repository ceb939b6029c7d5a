package com.dataflow.pipeline.service.rendering;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.SymbolAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.GrayPaintScale;
import org.jfree.chart.renderer.category.LineAndShapeRenderer;
import org.jfree.chart.renderer.xy.XYBlockRenderer;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.general.DefaultPieDataset;
import org.jfree.data.xy.DefaultXYZDataset;
import org.springframework.stereotype.Component;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.RenderBackend;
import com.dataflow.pipeline.dto.chart.RenderOutcome;
import com.dataflow.pipeline.exception.RenderBackendException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Primary backend: builds a JFreeChart, rasterizes it through a temporary PNG file and keeps the
 * data/layout description of the figure next to the image.
 */
@Slf4j
@Component("primaryChartRenderer")
@RequiredArgsConstructor
public class JFreeChartRenderer extends AbstractChartRenderer {

  private static final String TEMP_FILE_PREFIX = "chart-";

  private final ChartFigureFactory figureFactory;

  @Override
  public RenderBackend backend() {
    return RenderBackend.PRIMARY;
  }

  @Override
  protected boolean isEnabled(ChartRenderingConfig config) {
    return config.isPrimaryEnabled();
  }

  @Override
  protected RenderOutcome draw(ChartFigure figure, ChartRenderingConfig config)
      throws IOException {
    JFreeChart chart = buildChart(figure);
    chart.setBackgroundPaint(Color.WHITE);

    // The PNG is single-owner: written once, read once, removed on every path.
    Path image =
        config.getScratchDirectory() == null
            ? Files.createTempFile(TEMP_FILE_PREFIX, ".png")
            : Files.createTempFile(config.getScratchDirectory(), TEMP_FILE_PREFIX, ".png");
    try {
      ChartUtils.saveChartAsPNG(image.toFile(), chart, config.getWidth(), config.getHeight());
      byte[] bytes = Files.readAllBytes(image);
      if (bytes.length == 0) {
        throw new RenderBackendException(backend(), "Empty image for " + figure.getTitle());
      }
      return RenderOutcome.rendered(backend(), bytes, figureFactory.describe(figure, config));
    } finally {
      deleteQuietly(image);
    }
  }

  JFreeChart buildChart(ChartFigure figure) {
    switch (figure.getKind()) {
      case PIE:
        DefaultPieDataset<String> pieDataset = new DefaultPieDataset<>();
        for (int i = 0; i < figure.getCategories().size(); i++) {
          pieDataset.setValue(figure.getCategories().get(i), figure.getValues().get(i));
        }
        return ChartFactory.createPieChart(figure.getTitle(), pieDataset, true, false, false);
      case LINE:
        return ChartFactory.createLineChart(
            figure.getTitle(),
            figure.getXLabel(),
            figure.getYLabel(),
            categoryDataset(figure),
            PlotOrientation.VERTICAL,
            false,
            false,
            false);
      case SCATTER:
        JFreeChart scatter =
            ChartFactory.createLineChart(
                figure.getTitle(),
                figure.getXLabel(),
                figure.getYLabel(),
                categoryDataset(figure),
                PlotOrientation.VERTICAL,
                false,
                false,
                false);
        scatter.getCategoryPlot().setRenderer(new LineAndShapeRenderer(false, true));
        return scatter;
      case AREA:
        return ChartFactory.createAreaChart(
            figure.getTitle(),
            figure.getXLabel(),
            figure.getYLabel(),
            categoryDataset(figure),
            PlotOrientation.VERTICAL,
            false,
            false,
            false);
      case HEATMAP:
        return heatmap(figure);
      case BAR:
      default:
        return ChartFactory.createBarChart(
            figure.getTitle(),
            figure.getXLabel(),
            figure.getYLabel(),
            categoryDataset(figure),
            PlotOrientation.VERTICAL,
            false,
            false,
            false);
    }
  }

  private DefaultCategoryDataset categoryDataset(ChartFigure figure) {
    DefaultCategoryDataset dataset = new DefaultCategoryDataset();
    for (int i = 0; i < figure.getCategories().size(); i++) {
      dataset.addValue(figure.getValues().get(i), figure.getYLabel(), figure.getCategories().get(i));
    }
    return dataset;
  }

  private JFreeChart heatmap(ChartFigure figure) {
    List<List<Long>> matrix = figure.getMatrix();
    int rows = figure.getRowLabels().size();
    int columns = figure.getColumnLabels().size();
    if (rows == 0 || columns == 0) {
      throw new RenderBackendException(backend(), "Nothing to plot for " + figure.getTitle());
    }

    double[] xs = new double[rows * columns];
    double[] ys = new double[rows * columns];
    double[] zs = new double[rows * columns];
    int k = 0;
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        xs[k] = c;
        ys[k] = r;
        zs[k] = matrix.get(r).get(c);
        k++;
      }
    }
    DefaultXYZDataset dataset = new DefaultXYZDataset();
    dataset.addSeries("Count", new double[][] {xs, ys, zs});

    SymbolAxis xAxis =
        new SymbolAxis(figure.getXLabel(), figure.getColumnLabels().toArray(new String[0]));
    SymbolAxis yAxis =
        new SymbolAxis(figure.getYLabel(), figure.getRowLabels().toArray(new String[0]));
    XYBlockRenderer renderer = new XYBlockRenderer();
    renderer.setPaintScale(new GrayPaintScale(0, Math.max(1, figure.maxValue())));

    XYPlot plot = new XYPlot(dataset, xAxis, yAxis, renderer);
    return new JFreeChart(figure.getTitle(), JFreeChart.DEFAULT_TITLE_FONT, plot, false);
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary chart image {}: {}", path, e.getMessage());
    }
  }
}
