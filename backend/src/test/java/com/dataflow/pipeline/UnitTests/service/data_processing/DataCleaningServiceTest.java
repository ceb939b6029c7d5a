package com.dataflow.pipeline.UnitTests.service.data_processing;

import static com.dataflow.pipeline.fixtures.TestFixtures.dataset;
import static com.dataflow.pipeline.fixtures.TestFixtures.numeric;
import static com.dataflow.pipeline.fixtures.TestFixtures.row;
import static com.dataflow.pipeline.fixtures.TestFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.dataflow.pipeline.dto.cleaning.CleaningPolicy;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.service.data_processing.DataCleaningService;
import com.dataflow.pipeline.service.data_processing.ImputeMissingValuesStrategy;
import com.dataflow.pipeline.service.data_processing.MissingValueStrategy;

class DataCleaningServiceTest {

  private DataCleaningService cleaningService;

  @BeforeEach
  void setUp() {
    cleaningService = new DataCleaningService();
  }

  @Test
  void shouldDropEveryRowWithAMissingCell() {
    TabularDataset input =
        dataset(
            List.of(text("name"), numeric("age")),
            List.of(row("Ann", 31L), row("Bob", null), row(null, 40L), row("Cid", 22L)));

    TabularDataset cleaned = cleaningService.clean(input, CleaningPolicy.defaults());

    assertThat(cleaned.getColumnNames()).containsExactly("name", "age");
    assertThat(cleaned.getRows()).containsExactly(row("Ann", 31L), row("Cid", 22L));
  }

  @Test
  void shouldDropFullyEmptyColumnBeforeDroppingRows() {
    TabularDataset input =
        dataset(
            List.of(text("name"), text("notes"), numeric("age")),
            List.of(row("Ann", null, 31L), row("Bob", null, 45L)));

    TabularDataset cleaned = cleaningService.clean(input, CleaningPolicy.defaults());

    assertThat(cleaned.getColumnNames()).containsExactly("name", "age");
    assertThat(cleaned.rowCount()).isEqualTo(2);
  }

  @Test
  void shouldTreatEmptyStringsAsMissing() {
    TabularDataset input =
        dataset(
            List.of(text("city"), text("country")),
            List.of(row("Oslo", "Norway"), row("", "Sweden"), row("Lima", "Peru")));

    TabularDataset cleaned = cleaningService.clean(input, CleaningPolicy.defaults());

    assertThat(cleaned.columnValues(0)).containsExactly("Oslo", "Lima");
  }

  @Test
  void shouldRemoveRequestedColumnsAndIgnoreUnknownNames() {
    TabularDataset input =
        dataset(
            List.of(numeric("id"), text("name"), text("team")),
            List.of(row(1L, "Ann", "red"), row(2L, "Bob", "blue")));
    CleaningPolicy policy =
        CleaningPolicy.builder()
            .columnsToRemove(CleaningPolicy.parseRemovalList(" id , , does_not_exist"))
            .build();

    TabularDataset cleaned = cleaningService.clean(input, policy);

    assertThat(cleaned.getColumnNames()).containsExactly("name", "team");
    assertThat(cleaned.rowCount()).isEqualTo(2);
  }

  @Test
  void shouldReturnZeroRowsWhenEveryRowIsIncomplete() {
    TabularDataset input =
        dataset(
            List.of(text("a"), text("b")), List.of(row("x", null), row(null, "y")));

    TabularDataset cleaned = cleaningService.clean(input, CleaningPolicy.defaults());

    assertThat(cleaned.isEmpty()).isTrue();
    assertThat(cleaned.getColumnNames()).containsExactly("a", "b");
  }

  @Test
  void shouldImputeMedianForNumbersAndModeForText() {
    TabularDataset input =
        dataset(
            List.of(text("team"), numeric("score")),
            List.of(
                row("red", 1L), row("red", null), row(null, 3L), row("blue", 10L), row("red", 5L)));
    CleaningPolicy policy =
        CleaningPolicy.builder().missingValueStrategy(new ImputeMissingValuesStrategy()).build();

    TabularDataset cleaned = cleaningService.clean(input, policy);

    assertThat(cleaned.rowCount()).isEqualTo(5);
    assertThat(cleaned.getRows().get(1)).containsExactly("red", 4L);
    assertThat(cleaned.getRows().get(2)).containsExactly("red", 3L);
  }

  @Test
  void shouldDropColumnWithNothingToImpute() {
    TabularDataset input =
        dataset(List.of(text("team"), text("blank")), List.of(row("red", ""), row("blue", "")));
    CleaningPolicy policy =
        CleaningPolicy.builder().missingValueStrategy(new ImputeMissingValuesStrategy()).build();

    TabularDataset cleaned = cleaningService.clean(input, policy);

    assertThat(cleaned.getColumnNames()).containsExactly("team");
    assertThat(cleaned.rowCount()).isEqualTo(2);
  }

  @Test
  void shouldResolveStrategyFromConfiguredMode() {
    assertThat(MissingValueStrategy.forMode(MissingValueStrategy.Mode.IMPUTE))
        .isInstanceOf(ImputeMissingValuesStrategy.class);
    assertThat(MissingValueStrategy.forMode(MissingValueStrategy.Mode.DROP_ROWS).mode())
        .isEqualTo(MissingValueStrategy.Mode.DROP_ROWS);
  }

  @Test
  void shouldNeverLeaveMissingCellsOrEmptyRowsAndColumns() {
    Random random = new Random(20240611L);
    for (int iteration = 0; iteration < 300; iteration++) {
      int width = 1 + random.nextInt(6);
      int height = random.nextInt(15);
      double density = random.nextDouble();

      List<DatasetColumn> columns = new ArrayList<>();
      for (int c = 0; c < width; c++) {
        columns.add(c % 2 == 0 ? text("t" + c) : numeric("n" + c));
      }
      List<List<Object>> rows = new ArrayList<>();
      for (int r = 0; r < height; r++) {
        List<Object> line = new ArrayList<>();
        for (int c = 0; c < width; c++) {
          if (random.nextDouble() >= density) {
            line.add(random.nextBoolean() ? null : (c % 2 == 0 ? "" : null));
          } else {
            line.add(c % 2 == 0 ? "v" + random.nextInt(4) : (long) random.nextInt(9));
          }
        }
        rows.add(line);
      }

      for (MissingValueStrategy.Mode mode : MissingValueStrategy.Mode.values()) {
        CleaningPolicy policy =
            CleaningPolicy.builder()
                .missingValueStrategy(MissingValueStrategy.forMode(mode))
                .columnsToRemove(Set.of("n1"))
                .build();
        TabularDataset cleaned = cleaningService.clean(dataset(columns, rows), policy);

        assertThat(cleaned.getColumnNames()).doesNotContain("n1");
        for (List<Object> line : cleaned.getRows()) {
          assertThat(line).doesNotContainNull().doesNotContain("");
        }
        if (!cleaned.isEmpty()) {
          for (int c = 0; c < cleaned.columnCount(); c++) {
            assertThat(cleaned.columnValues(c)).anyMatch(value -> value != null);
          }
        }
      }
    }
  }
}
