package com.dataflow.pipeline.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.DatasetReadException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CsvDatasetReader {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final ColumnKindDetector columnKindDetector;
  private final ApplicationProperties properties;

  public TabularDataset read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.getFileName().toString());
    } catch (IOException e) {
      throw new DatasetReadException("Could not read CSV file " + path.getFileName(), e);
    }
  }

  public TabularDataset read(InputStream csvStream, String fileName) {
    List<String> headers;
    List<String[]> rawRows = new ArrayList<>();
    Set<String> missingTokens = new HashSet<>(properties.getLoader().getMissingValueTokens());

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] headerRow = reader.readNext();
      if (headerRow == null || headerRow.length == 0) {
        throw new DatasetReadException("CSV file " + fileName + " has no headers");
      }
      headers = uniqueHeaders(headerRow);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length != headers.size()) {
          log.debug("Row width {} differs from header width {}", row.length, headers.size());
        }
        rawRows.add(row);
      }
    } catch (IOException | CsvValidationException e) {
      throw new DatasetReadException("Malformed CSV file " + fileName + ": " + e.getMessage(), e);
    }

    int width = headers.size();
    List<List<String>> columnsRaw = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      List<String> values = new ArrayList<>(rawRows.size());
      for (String[] row : rawRows) {
        String value = c < row.length ? row[c] : null;
        values.add(value == null || missingTokens.contains(value) ? null : value);
      }
      columnsRaw.add(values);
    }

    List<DatasetColumn> columns = new ArrayList<>(width);
    List<List<Object>> typedColumns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      ColumnKindDetector.TypedColumn typed =
          columnKindDetector.detect(headers.get(c), columnsRaw.get(c));
      columns.add(new DatasetColumn(headers.get(c), typed.getKind(), typed.isTemporalValues()));
      typedColumns.add(typed.getValues());
    }

    List<List<Object>> rows = new ArrayList<>(rawRows.size());
    for (int r = 0; r < rawRows.size(); r++) {
      List<Object> row = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        row.add(typedColumns.get(c).get(r));
      }
      rows.add(row);
    }

    log.info("Loaded CSV {}: {} rows, columns {}", fileName, rows.size(), columns);
    return new TabularDataset(columns, rows);
  }

  /** Blank names become {@code Unnamed: <i>}; repeated names get a {@code .1}, {@code .2} suffix. */
  static List<String> uniqueHeaders(String[] headerRow) {
    List<String> headers = new ArrayList<>(headerRow.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < headerRow.length; i++) {
      String name = headerRow[i] == null ? "" : headerRow[i];
      if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
        name = name.substring(1);
      }
      if (name.trim().isEmpty()) {
        name = "Unnamed: " + i;
      }
      String candidate = name;
      int suffix = 1;
      while (!seen.add(candidate)) {
        candidate = name + "." + suffix++;
      }
      headers.add(candidate);
    }
    return headers;
  }
}
