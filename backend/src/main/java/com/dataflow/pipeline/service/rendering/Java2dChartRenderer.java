package com.dataflow.pipeline.service.rendering;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import javax.imageio.ImageIO;

import org.springframework.stereotype.Component;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.dto.chart.ChartFigure;
import com.dataflow.pipeline.dto.chart.ChartKind;
import com.dataflow.pipeline.dto.chart.RenderBackend;
import com.dataflow.pipeline.dto.chart.RenderOutcome;
import com.dataflow.pipeline.exception.RenderBackendException;

/**
 * Secondary backend: draws a static version of the figure directly on a {@link BufferedImage}, same
 * size and axes as the primary. No figure description is produced.
 */
@Component("secondaryChartRenderer")
public class Java2dChartRenderer extends AbstractChartRenderer {

  private static final int MARGIN_LEFT = 70;
  private static final int MARGIN_RIGHT = 30;
  private static final int MARGIN_TOP = 50;
  private static final int MARGIN_BOTTOM = 70;
  private static final int MAX_LABEL_CHARS = 12;

  private static final Color[] PALETTE = {
    new Color(0x63, 0x6E, 0xFA),
    new Color(0xEF, 0x55, 0x3B),
    new Color(0x00, 0xCC, 0x96),
    new Color(0xAB, 0x63, 0xFA),
    new Color(0xFF, 0xA1, 0x5A),
    new Color(0x19, 0xD3, 0xF3),
    new Color(0xFF, 0x66, 0x92),
    new Color(0xB6, 0xE8, 0x80)
  };

  @Override
  public RenderBackend backend() {
    return RenderBackend.SECONDARY;
  }

  @Override
  protected boolean isEnabled(ChartRenderingConfig config) {
    return config.isSecondaryEnabled();
  }

  @Override
  protected RenderOutcome draw(ChartFigure figure, ChartRenderingConfig config)
      throws IOException {
    int width = config.getWidth();
    int height = config.getHeight();
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, width, height);
      drawTitle(g, figure.getTitle(), width);

      switch (figure.getKind()) {
        case PIE:
          drawPie(g, figure, width, height);
          break;
        case HEATMAP:
          drawHeatmap(g, figure, width, height);
          break;
        default:
          drawSeries(g, figure, width, height);
          break;
      }
    } finally {
      g.dispose();
    }

    ByteArrayOutputStream png = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "png", png)) {
      throw new RenderBackendException(backend(), "No PNG writer available");
    }
    return RenderOutcome.rendered(backend(), png.toByteArray(), null);
  }

  private void drawTitle(Graphics2D g, String title, int width) {
    g.setColor(Color.DARK_GRAY);
    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 16));
    FontMetrics metrics = g.getFontMetrics();
    g.drawString(title, Math.max(5, (width - metrics.stringWidth(title)) / 2), 30);
  }

  /** Bar, line, scatter and area: categories along X, values on a zero-based Y axis. */
  private void drawSeries(Graphics2D g, ChartFigure figure, int width, int height) {
    int plotLeft = MARGIN_LEFT;
    int plotRight = width - MARGIN_RIGHT;
    int plotTop = MARGIN_TOP;
    int plotBottom = height - MARGIN_BOTTOM;
    drawAxes(g, figure, plotLeft, plotRight, plotTop, plotBottom);

    List<Long> values = figure.getValues();
    int n = values.size();
    if (n == 0) {
      return;
    }
    double max = Math.max(1, figure.maxValue());
    double slot = (plotRight - plotLeft) / (double) n;
    int[] xs = new int[n];
    int[] ys = new int[n];
    for (int i = 0; i < n; i++) {
      xs[i] = (int) Math.round(plotLeft + slot * (i + 0.5));
      ys[i] = (int) Math.round(plotBottom - (values.get(i) / max) * (plotBottom - plotTop));
    }

    g.setColor(PALETTE[0]);
    ChartKind kind = figure.getKind();
    if (kind == ChartKind.BAR) {
      int barWidth = Math.max(1, (int) (slot * 0.7));
      for (int i = 0; i < n; i++) {
        g.fillRect(xs[i] - barWidth / 2, ys[i], barWidth, plotBottom - ys[i]);
      }
    } else if (kind == ChartKind.AREA) {
      Polygon area = new Polygon();
      area.addPoint(xs[0], plotBottom);
      for (int i = 0; i < n; i++) {
        area.addPoint(xs[i], ys[i]);
      }
      area.addPoint(xs[n - 1], plotBottom);
      g.setColor(new Color(PALETTE[0].getRed(), PALETTE[0].getGreen(), PALETTE[0].getBlue(), 110));
      g.fillPolygon(area);
      g.setColor(PALETTE[0]);
      g.setStroke(new BasicStroke(2f));
      g.drawPolyline(xs, ys, n);
    } else if (kind == ChartKind.LINE) {
      g.setStroke(new BasicStroke(2f));
      g.drawPolyline(xs, ys, n);
    } else {
      for (int i = 0; i < n; i++) {
        g.fillOval(xs[i] - 4, ys[i] - 4, 8, 8);
      }
    }

    g.setColor(Color.DARK_GRAY);
    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
    FontMetrics metrics = g.getFontMetrics();
    for (int i = 0; i < n; i++) {
      String label = shorten(figure.getCategories().get(i));
      g.drawString(label, xs[i] - metrics.stringWidth(label) / 2, plotBottom + 15);
    }
  }

  private void drawAxes(
      Graphics2D g, ChartFigure figure, int left, int right, int top, int bottom) {
    g.setColor(Color.GRAY);
    g.setStroke(new BasicStroke(1f));
    g.drawLine(left, bottom, right, bottom);
    g.drawLine(left, top, left, bottom);

    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
    FontMetrics metrics = g.getFontMetrics();
    String max = Long.toString(Math.max(1, figure.maxValue()));
    g.drawString(max, left - metrics.stringWidth(max) - 5, top + 5);
    g.drawString("0", left - metrics.stringWidth("0") - 5, bottom);

    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 12));
    metrics = g.getFontMetrics();
    String xLabel = figure.getXLabel();
    g.drawString(xLabel, (left + right - metrics.stringWidth(xLabel)) / 2, bottom + 40);
    g.drawString(figure.getYLabel(), 5, top - 10);
  }

  private void drawPie(Graphics2D g, ChartFigure figure, int width, int height) {
    List<Long> values = figure.getValues();
    long total = 0;
    for (Long value : values) {
      total += value;
    }
    int diameter = Math.min(width / 2, height - MARGIN_TOP - 40);
    int x = MARGIN_LEFT / 2;
    int y = MARGIN_TOP + 10;
    if (total <= 0) {
      g.setColor(Color.LIGHT_GRAY);
      g.drawOval(x, y, diameter, diameter);
      return;
    }

    double start = 90;
    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 11));
    for (int i = 0; i < values.size(); i++) {
      double extent = 360.0 * values.get(i) / total;
      Color color = PALETTE[i % PALETTE.length];
      g.setColor(color);
      g.fillArc(x, y, diameter, diameter, (int) Math.round(start), -(int) Math.ceil(extent));
      start -= extent;

      int legendY = y + 15 + i * 18;
      if (legendY < height - 10) {
        g.fillRect(x + diameter + 30, legendY - 10, 12, 12);
        g.setColor(Color.DARK_GRAY);
        g.drawString(
            shorten(figure.getCategories().get(i)) + " (" + values.get(i) + ")",
            x + diameter + 48,
            legendY);
      }
    }
  }

  /** Cells shaded from white (0) to the palette's first color (maximum count). */
  private void drawHeatmap(Graphics2D g, ChartFigure figure, int width, int height) {
    int rows = figure.getRowLabels().size();
    int columns = figure.getColumnLabels().size();
    int plotLeft = MARGIN_LEFT + 20;
    int plotRight = width - MARGIN_RIGHT;
    int plotTop = MARGIN_TOP;
    int plotBottom = height - MARGIN_BOTTOM;
    if (rows == 0 || columns == 0) {
      throw new RenderBackendException(backend(), "Nothing to plot for " + figure.getTitle());
    }

    double cellWidth = (plotRight - plotLeft) / (double) columns;
    double cellHeight = (plotBottom - plotTop) / (double) rows;
    double max = Math.max(1, figure.maxValue());
    Color hot = PALETTE[0];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        double t = figure.getMatrix().get(r).get(c) / max;
        g.setColor(
            new Color(
                (int) Math.round(255 + (hot.getRed() - 255) * t),
                (int) Math.round(255 + (hot.getGreen() - 255) * t),
                (int) Math.round(255 + (hot.getBlue() - 255) * t)));
        int x0 = (int) Math.round(plotLeft + c * cellWidth);
        int y0 = (int) Math.round(plotTop + r * cellHeight);
        int x1 = (int) Math.round(plotLeft + (c + 1) * cellWidth);
        int y1 = (int) Math.round(plotTop + (r + 1) * cellHeight);
        g.fillRect(x0, y0, x1 - x0, y1 - y0);
      }
    }

    g.setColor(Color.DARK_GRAY);
    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
    FontMetrics metrics = g.getFontMetrics();
    for (int r = 0; r < rows; r++) {
      String label = shorten(figure.getRowLabels().get(r));
      int y = (int) Math.round(plotTop + (r + 0.5) * cellHeight) + 4;
      g.drawString(label, plotLeft - metrics.stringWidth(label) - 5, y);
    }
    for (int c = 0; c < columns; c++) {
      String label = shorten(figure.getColumnLabels().get(c));
      int x = (int) Math.round(plotLeft + (c + 0.5) * cellWidth);
      g.drawString(label, x - metrics.stringWidth(label) / 2, plotBottom + 15);
    }
    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 12));
    g.drawString(figure.getXLabel(), (plotLeft + plotRight) / 2, plotBottom + 40);
    g.drawString(figure.getYLabel(), 5, plotTop - 10);
  }

  private String shorten(String label) {
    return label.length() <= MAX_LABEL_CHARS ? label : label.substring(0, MAX_LABEL_CHARS - 3) + "...";
  }
}
