package com.dataflow.pipeline.service.workbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Drawing;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.config.DashboardLayout;
import com.dataflow.pipeline.dto.chart.ChartSpec;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.dto.pivot.PivotTable;
import com.dataflow.pipeline.dto.workbook.AssembledWorkbook;
import com.dataflow.pipeline.exception.WorkbookAssemblyException;
import com.dataflow.pipeline.util.CellValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the downloadable workbook: the cleaned data, every pivot table one below the other, and
 * (when requested) a dashboard sheet holding the rendered chart images two per row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkbookAssemblerService {

  public static final String CLEANED_DATA_SHEET = "CleanedData";
  public static final String PIVOT_TABLES_SHEET = "PivotTables";
  public static final String DASHBOARD_SHEET = "Dashboard";

  static final String PIVOT_SHEET_TITLE = "All Pivot Tables";
  private static final int PIVOT_FIRST_ROW = 2;
  private static final int PIVOT_GAP_ROWS = 2;
  private static final double DEFAULT_COLUMN_WIDTH_PX = 64.0;
  private static final double DEFAULT_ROW_HEIGHT_PX = 20.0;

  private final DashboardLayout dashboardLayout;
  private final ChartRenderingConfig renderingConfig;

  /**
   * @param charts rendered charts, or null when no dashboard was requested
   */
  public AssembledWorkbook assemble(
      TabularDataset cleaned, List<PivotTable> pivots, List<ChartSpec> charts) {
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Styles styles = new Styles(workbook);
      writeCleanedData(workbook.createSheet(CLEANED_DATA_SHEET), cleaned, styles);
      writePivotTables(workbook.createSheet(PIVOT_TABLES_SHEET), pivots, styles);

      int embedded = 0;
      if (charts != null && !pivots.isEmpty()) {
        embedded = writeDashboard(workbook, workbook.createSheet(DASHBOARD_SHEET), charts, styles);
      }

      List<String> sheetNames = new ArrayList<>();
      for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
        sheetNames.add(workbook.getSheetName(i));
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      workbook.write(out);
      log.info(
          "Assembled workbook: sheets {}, {} pivot table(s), {} chart image(s), {} bytes",
          sheetNames,
          pivots.size(),
          embedded,
          out.size());
      return new AssembledWorkbook(out.toByteArray(), sheetNames, embedded);
    } catch (IOException e) {
      throw new WorkbookAssemblyException("Could not write workbook: " + e.getMessage(), e);
    }
  }

  void writeCleanedData(Sheet sheet, TabularDataset dataset, Styles styles) {
    Row headerRow = sheet.createRow(0);
    List<String> names = dataset.getColumnNames();
    for (int c = 0; c < names.size(); c++) {
      Cell cell = headerRow.createCell(c);
      cell.setCellValue(names.get(c));
      cell.setCellStyle(styles.header);
    }
    for (int r = 0; r < dataset.rowCount(); r++) {
      Row row = sheet.createRow(r + 1);
      List<Object> values = dataset.getRows().get(r);
      for (int c = 0; c < values.size(); c++) {
        setCellValue(row.createCell(c), values.get(c), styles);
      }
    }
  }

  void writePivotTables(Sheet sheet, List<PivotTable> pivots, Styles styles) {
    Cell banner = sheet.createRow(0).createCell(0);
    banner.setCellValue(PIVOT_SHEET_TITLE);
    banner.setCellStyle(styles.banner);

    int current = PIVOT_FIRST_ROW;
    for (PivotTable pivot : pivots) {
      Cell title = sheet.createRow(current).createCell(0);
      title.setCellValue("Pivot: " + pivot.getTitle());
      title.setCellStyle(styles.header);
      int lastColumn = pivot.getHeaders().size();
      if (lastColumn > 0) {
        sheet.addMergedRegion(new CellRangeAddress(current, current, 0, lastColumn));
      }
      current++;

      for (List<Object> line : pivot.toGrid()) {
        Row row = sheet.createRow(current++);
        for (int c = 0; c < line.size(); c++) {
          setCellValue(row.createCell(c), line.get(c), styles);
        }
      }
      current += PIVOT_GAP_ROWS;
    }
  }

  /** Returns the number of embedded images. Charts without an image take no slot. */
  int writeDashboard(Workbook workbook, Sheet sheet, List<ChartSpec> charts, Styles styles) {
    sheet.setDisplayGridlines(false);
    Cell banner = sheet.createRow(1).createCell(1);
    banner.setCellValue(dashboardLayout.getTitle());
    banner.setCellStyle(styles.banner);

    CreationHelper helper = workbook.getCreationHelper();
    Drawing<?> drawing = sheet.createDrawingPatriarch();
    int columnSpan = (int) Math.ceil(renderingConfig.getWidth() / DEFAULT_COLUMN_WIDTH_PX);
    int rowSpan = (int) Math.ceil(renderingConfig.getHeight() / DEFAULT_ROW_HEIGHT_PX);

    int position = 0;
    for (ChartSpec chart : charts) {
      if (!chart.hasImage()) {
        log.debug("No image for '{}', not placed on dashboard", chart.getTitle());
        continue;
      }
      try {
        int pictureIndex = workbook.addPicture(chart.getImage(), Workbook.PICTURE_TYPE_PNG);
        ClientAnchor anchor = helper.createClientAnchor();
        int column = dashboardLayout.anchorColumn(position) - 1;
        int row = dashboardLayout.anchorRow(position) - 1;
        anchor.setCol1(column);
        anchor.setRow1(row);
        anchor.setCol2(column + columnSpan);
        anchor.setRow2(row + rowSpan);
        drawing.createPicture(anchor, pictureIndex);
        position++;
      } catch (RuntimeException e) {
        log.warn("Could not embed chart '{}': {}", chart.getTitle(), e.getMessage());
      }
    }
    return position;
  }

  private void setCellValue(Cell cell, Object value, Styles styles) {
    if (value == null) {
      cell.setBlank();
    } else if (value instanceof Number) {
      cell.setCellValue(((Number) value).doubleValue());
    } else if (value instanceof Boolean) {
      cell.setCellValue((Boolean) value);
    } else if (value instanceof LocalDateTime) {
      cell.setCellValue((LocalDateTime) value);
      cell.setCellStyle(styles.dateTime);
    } else if (value instanceof LocalDate) {
      cell.setCellValue((LocalDate) value);
      cell.setCellStyle(styles.date);
    } else {
      cell.setCellValue(CellValues.label(value));
    }
  }

  static final class Styles {
    final CellStyle header;
    final CellStyle banner;
    final CellStyle date;
    final CellStyle dateTime;

    Styles(Workbook workbook) {
      Font bold = workbook.createFont();
      bold.setBold(true);
      header = workbook.createCellStyle();
      header.setFont(bold);

      Font large = workbook.createFont();
      large.setBold(true);
      large.setFontHeightInPoints((short) 14);
      banner = workbook.createCellStyle();
      banner.setFont(large);

      CreationHelper helper = workbook.getCreationHelper();
      date = workbook.createCellStyle();
      date.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd"));
      dateTime = workbook.createCellStyle();
      dateTime.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));
    }
  }
}
