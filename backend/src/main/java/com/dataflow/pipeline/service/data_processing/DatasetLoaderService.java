package com.dataflow.pipeline.service.data_processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.DatasetReadException;
import com.dataflow.pipeline.exception.NoInputException;
import com.dataflow.pipeline.exception.UnsupportedFormatException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetLoaderService {

  private final CsvDatasetReader csvDatasetReader;
  private final SpreadsheetDatasetReader spreadsheetDatasetReader;
  private final ApplicationProperties properties;

  /**
   * Loads the source file. A directory stands for an upload location: its first regular file in
   * name order is used.
   */
  public TabularDataset load(Path source) {
    Path file = resolveSourceFile(source);
    String extension = extractFileExtension(file.getFileName().toString());

    ApplicationProperties.Loader loader = properties.getLoader();
    if (loader.getSpreadsheetExtensions().contains(extension)) {
      log.info("Loading spreadsheet {}", file.getFileName());
      return spreadsheetDatasetReader.read(file);
    }
    if (loader.getDelimitedExtensions().contains(extension)) {
      log.info("Loading delimited file {}", file.getFileName());
      return csvDatasetReader.read(file);
    }
    throw new UnsupportedFormatException(extension);
  }

  Path resolveSourceFile(Path source) {
    if (source == null) {
      throw new NoInputException("No uploaded file found.");
    }
    if (Files.isRegularFile(source)) {
      return source;
    }
    if (!Files.isDirectory(source)) {
      throw new NoInputException("No uploaded file found at " + source);
    }
    Optional<Path> first;
    try (Stream<Path> entries = Files.list(source)) {
      first = entries.filter(Files::isRegularFile).sorted().findFirst();
    } catch (IOException e) {
      throw new DatasetReadException("Could not list upload location " + source, e);
    }
    return first.orElseThrow(() -> new NoInputException("No uploaded file found in " + source));
  }

  static String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
  }
}
