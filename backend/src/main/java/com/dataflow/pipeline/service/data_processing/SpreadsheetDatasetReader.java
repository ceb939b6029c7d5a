package com.dataflow.pipeline.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.DatasetReadException;
import com.dataflow.pipeline.exception.PipelineException;

import lombok.extern.slf4j.Slf4j;

/** Reads the first sheet of an .xlsx or .xls workbook, taking its first row as the header. */
@Slf4j
@Service
public class SpreadsheetDatasetReader {

  private final DataFormatter headerFormatter = new DataFormatter();

  public TabularDataset read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.getFileName().toString());
    } catch (IOException e) {
      throw new DatasetReadException("Could not read spreadsheet " + path.getFileName(), e);
    }
  }

  public TabularDataset read(InputStream spreadsheetStream, String fileName) {
    try (Workbook workbook = WorkbookFactory.create(spreadsheetStream)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new DatasetReadException("Spreadsheet " + fileName + " has no sheets");
      }
      return readSheet(workbook.getSheetAt(0), fileName);
    } catch (PipelineException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DatasetReadException(
          "Malformed spreadsheet " + fileName + ": " + e.getMessage(), e);
    }
  }

  private TabularDataset readSheet(Sheet sheet, String fileName) {
    Row headerRow = sheet.getRow(sheet.getFirstRowNum());
    if (headerRow == null || headerRow.getLastCellNum() <= 0) {
      throw new DatasetReadException("Spreadsheet " + fileName + " has no headers");
    }

    int width = headerRow.getLastCellNum();
    String[] headerNames = new String[width];
    for (int c = 0; c < width; c++) {
      Cell cell = headerRow.getCell(c);
      headerNames[c] = cell == null ? "" : headerFormatter.formatCellValue(cell);
    }
    List<String> headers = CsvDatasetReader.uniqueHeaders(headerNames);

    List<List<Object>> rows = new ArrayList<>();
    for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
      Row row = sheet.getRow(r);
      List<Object> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(row == null ? null : cellValue(row.getCell(c)));
      }
      rows.add(values);
    }

    List<DatasetColumn> columns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      ColumnKind kind = declareKind(rows, c);
      columns.add(new DatasetColumn(headers.get(c), kind));
    }

    log.info("Loaded spreadsheet {}: {} rows, columns {}", fileName, rows.size(), columns);
    return new TabularDataset(columns, rows);
  }

  private Object cellValue(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case NUMERIC:
        if (DateUtil.isCellDateFormatted(cell)) {
          return cell.getLocalDateTimeCellValue();
        }
        double number = cell.getNumericCellValue();
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
          return (long) number;
        }
        return number;
      case STRING:
        return cell.getStringCellValue();
      case BOOLEAN:
        return cell.getBooleanCellValue();
      default:
        return null;
    }
  }

  /**
   * Numbers only: NUMERIC (integral values widened to Double when the column also has fractions).
   * Dates only: DATETIME. Any text: TEXT. Booleans or nothing at all: UNKNOWN.
   */
  private ColumnKind declareKind(List<List<Object>> rows, int column) {
    boolean sawNumber = false;
    boolean sawFraction = false;
    boolean sawDate = false;
    boolean sawText = false;
    boolean sawOther = false;
    for (List<Object> row : rows) {
      Object value = row.get(column);
      if (value == null) {
        continue;
      }
      if (value instanceof Number) {
        sawNumber = true;
        sawFraction |= value instanceof Double;
      } else if (value instanceof LocalDateTime) {
        sawDate = true;
      } else if (value instanceof String) {
        sawText = true;
      } else {
        sawOther = true;
      }
    }

    if (sawText || (sawNumber && sawDate)) {
      return ColumnKind.TEXT;
    }
    if (sawNumber && !sawOther) {
      if (sawFraction) {
        for (List<Object> row : rows) {
          Object value = row.get(column);
          if (value instanceof Long) {
            row.set(column, ((Long) value).doubleValue());
          }
        }
      }
      return ColumnKind.NUMERIC;
    }
    if (sawDate && !sawOther) {
      return ColumnKind.DATETIME;
    }
    return sawNumber || sawDate ? ColumnKind.TEXT : ColumnKind.UNKNOWN;
  }
}
