package com.dataflow.pipeline.UnitTests.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.DatasetReadException;
import com.dataflow.pipeline.fixtures.TestFixtures;
import com.dataflow.pipeline.service.data_processing.ColumnKindDetector;
import com.dataflow.pipeline.service.data_processing.CsvDatasetReader;

class CsvDatasetReaderTest {

  private CsvDatasetReader reader;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = TestFixtures.defaultProperties();
    reader = new CsvDatasetReader(new ColumnKindDetector(properties), properties);
  }

  private TabularDataset read(String csv) {
    return reader.read(
        new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), "upload.csv");
  }

  @Test
  void shouldTypeTextAndNumericColumns() {
    TabularDataset dataset = read(String.join("\n", TestFixtures.salesCsvLines()));

    assertThat(dataset.getColumnNames()).containsExactly("region", "category", "amount");
    assertThat(dataset.rowCount()).isEqualTo(12);
    assertThat(dataset.column("region").getKind()).isEqualTo(ColumnKind.TEXT);
    assertThat(dataset.column("amount").getKind()).isEqualTo(ColumnKind.NUMERIC);
    assertThat(dataset.getRows().get(0)).containsExactly("North", "A", 100L);
  }

  @Test
  void shouldWidenIntegralValuesWhenColumnHasFractions() {
    TabularDataset dataset =
        read("item,price\npen,1\nbook,12.5\nlamp,30\nmug,4.25\ncup,3\nbag,19.99\n");

    assertThat(dataset.column("price").getKind()).isEqualTo(ColumnKind.NUMERIC);
    assertThat(dataset.columnValues(1)).containsExactly(1.0, 12.5, 30.0, 4.25, 3.0, 19.99);
  }

  @Test
  void shouldTreatMissingValueTokensAsMissing() {
    TabularDataset dataset = read("name,city\nAnn,NA\nBob,\nCid,n/a\nDee,Rome\n");

    assertThat(dataset.columnValues(1)).containsExactly(null, null, null, "Rome");
  }

  @Test
  void shouldPadShortRowsWithMissingCells() {
    TabularDataset dataset = read("a,b,c\nx,y,z\nonly\n");

    assertThat(dataset.getRows().get(1)).containsExactly("only", null, null);
  }

  @Test
  void shouldNameBlankAndRepeatedHeaders() {
    TabularDataset dataset = read("\uFEFFname,,name,name\nAnn,1,2,3\n");

    assertThat(dataset.getColumnNames())
        .containsExactly("name", "Unnamed: 1", "name.1", "name.2");
  }

  @Test
  void shouldKeepDateStringsAsTextFlaggedTemporal() {
    StringBuilder csv = new StringBuilder("order_day,region\n");
    for (int day = 1; day <= 12; day++) {
      csv.append(String.format("2024-01-%02d,%s%n", day, day % 2 == 0 ? "North" : "South"));
    }

    TabularDataset dataset = read(csv.toString());

    assertThat(dataset.column("order_day").getKind()).isEqualTo(ColumnKind.TEXT);
    assertThat(dataset.column("order_day").isTemporalValues()).isTrue();
    assertThat(dataset.column("region").isTemporalValues()).isFalse();
    assertThat(dataset.getRows().get(0)).containsExactly("2024-01-01", "South");
  }

  @Test
  void shouldKeepYesNoColumnsAsText() {
    TabularDataset dataset =
        read("name,member\nAnn,Yes\nBob,No\nCid,Yes\nDee,No\nEve,Yes\nFay,No\n");

    assertThat(dataset.column("member").getKind()).isEqualTo(ColumnKind.TEXT);
    assertThat(dataset.columnValues(1)).containsExactly("Yes", "No", "Yes", "No", "Yes", "No");
  }

  @Test
  void shouldReadLiteralTrueFalseColumnsAsBooleans() {
    TabularDataset dataset =
        read("name,active\nAnn,true\nBob,false\nCid,TRUE\nDee,False\nEve,true\nFay,false\n");

    assertThat(dataset.column("active").getKind()).isEqualTo(ColumnKind.UNKNOWN);
    assertThat(dataset.columnValues(1)).containsExactly(true, false, true, false, true, false);
  }

  @Test
  void shouldReportAllMissingColumnAsUnknown() {
    TabularDataset dataset = read("name,empty\nAnn,\nBob,NULL\n");

    assertThat(dataset.column("empty").getKind()).isEqualTo(ColumnKind.UNKNOWN);
  }

  @Test
  void shouldRejectFileWithoutHeader() {
    assertThatThrownBy(() -> read(""))
        .isInstanceOf(DatasetReadException.class)
        .hasMessageContaining("no headers");
  }
}
