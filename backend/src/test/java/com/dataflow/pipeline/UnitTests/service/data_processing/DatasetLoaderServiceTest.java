package com.dataflow.pipeline.UnitTests.service.data_processing;

import static com.dataflow.pipeline.fixtures.TestFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.NoInputException;
import com.dataflow.pipeline.exception.UnsupportedFormatException;
import com.dataflow.pipeline.fixtures.TestFixtures;
import com.dataflow.pipeline.service.data_processing.CsvDatasetReader;
import com.dataflow.pipeline.service.data_processing.DatasetLoaderService;
import com.dataflow.pipeline.service.data_processing.SpreadsheetDatasetReader;

@ExtendWith(MockitoExtension.class)
class DatasetLoaderServiceTest {

  @TempDir Path tempDir;

  @Mock private CsvDatasetReader csvDatasetReader;
  @Mock private SpreadsheetDatasetReader spreadsheetDatasetReader;

  private DatasetLoaderService loaderService;

  @BeforeEach
  void setUp() {
    loaderService =
        new DatasetLoaderService(
            csvDatasetReader, spreadsheetDatasetReader, TestFixtures.defaultProperties());
  }

  @Test
  void shouldDispatchCsvByExtensionIgnoringCase() {
    Path file = TestFixtures.writeCsv(tempDir, "DATA.CSV", List.of("a", "1"));
    TabularDataset expected = TestFixtures.salesDataset();
    when(csvDatasetReader.read(file)).thenReturn(expected);

    assertThat(loaderService.load(file)).isSameAs(expected);
    verify(spreadsheetDatasetReader, never()).read(any(Path.class));
  }

  @Test
  void shouldDispatchSpreadsheetByExtension() {
    Path file = TestFixtures.writeXlsx(tempDir, "book.xlsx", List.of(row("a"), row(1)));
    TabularDataset expected = TestFixtures.salesDataset();
    when(spreadsheetDatasetReader.read(file)).thenReturn(expected);

    assertThat(loaderService.load(file)).isSameAs(expected);
  }

  @Test
  void shouldUseFirstFileOfUploadDirectoryInNameOrder() throws Exception {
    Files.createDirectory(tempDir.resolve("nested"));
    Path first = TestFixtures.writeCsv(tempDir, "a_first.csv", List.of("a", "1"));
    TestFixtures.writeCsv(tempDir, "b_second.csv", List.of("b", "2"));
    TabularDataset expected = TestFixtures.salesDataset();
    when(csvDatasetReader.read(first)).thenReturn(expected);

    assertThat(loaderService.load(tempDir)).isSameAs(expected);
  }

  @Test
  void shouldRejectUnsupportedExtension() {
    Path file = TestFixtures.writeCsv(tempDir, "notes.txt", List.of("hello"));

    assertThatThrownBy(() -> loaderService.load(file))
        .isInstanceOf(UnsupportedFormatException.class)
        .hasMessageContaining("'txt'")
        .extracting("status")
        .isEqualTo(400);
  }

  @Test
  void shouldReportMissingInput() {
    assertThatThrownBy(() -> loaderService.load(null)).isInstanceOf(NoInputException.class);
    assertThatThrownBy(() -> loaderService.load(tempDir.resolve("gone.csv")))
        .isInstanceOf(NoInputException.class);
    assertThatThrownBy(() -> loaderService.load(tempDir))
        .isInstanceOf(NoInputException.class)
        .hasMessageContaining("No uploaded file found");
  }
}
