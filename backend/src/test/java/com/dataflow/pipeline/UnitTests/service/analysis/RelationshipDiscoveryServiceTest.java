package com.dataflow.pipeline.UnitTests.service.analysis;

import static com.dataflow.pipeline.fixtures.TestFixtures.dataset;
import static com.dataflow.pipeline.fixtures.TestFixtures.numeric;
import static com.dataflow.pipeline.fixtures.TestFixtures.row;
import static com.dataflow.pipeline.fixtures.TestFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.dataflow.pipeline.dto.analysis.ColumnProfile;
import com.dataflow.pipeline.dto.analysis.ColumnRole;
import com.dataflow.pipeline.dto.analysis.DiscoveryResult;
import com.dataflow.pipeline.dto.analysis.Relationship;
import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.NoUsableColumnsException;
import com.dataflow.pipeline.fixtures.TestFixtures;
import com.dataflow.pipeline.service.analysis.RelationshipDiscoveryService;

class RelationshipDiscoveryServiceTest {

  private RelationshipDiscoveryService discoveryService;

  @BeforeEach
  void setUp() {
    discoveryService = new RelationshipDiscoveryService();
  }

  /** Columns with 2, 4, 3 and 4 distinct values, in that order. */
  private TabularDataset fourCategoricals() {
    return dataset(
        List.of(text("two"), text("four_a"), text("three"), text("four_b")),
        List.of(
            row("x", "a", "p", "m"),
            row("y", "b", "q", "n"),
            row("x", "c", "r", "o"),
            row("y", "d", "p", "z")));
  }

  private static List<List<String>> columnsOf(DiscoveryResult result) {
    return result.getRelationships().stream()
        .map(Relationship::getColumns)
        .collect(Collectors.toList());
  }

  @Test
  void shouldPairCategoricalsByDistinctCountWithStableTies() {
    DiscoveryResult result = discoveryService.discover(fourCategoricals(), 4);

    assertThat(columnsOf(result))
        .containsExactly(
            List.of("four_a", "four_b"),
            List.of("four_a", "three"),
            List.of("four_a", "two"),
            List.of("four_b", "three"));
    assertThat(result.getRelationships())
        .extracting(Relationship::getPosition)
        .containsExactly(0, 1, 2, 3);
    assertThat(result.getRelationships().get(0).getTitle()).isEqualTo("four_a vs four_b");
  }

  @Test
  void shouldSelectSameRelationshipsOnRepeatedRuns() {
    List<List<String>> first = columnsOf(discoveryService.discover(fourCategoricals(), 3));

    for (int i = 0; i < 20; i++) {
      assertThat(columnsOf(discoveryService.discover(fourCategoricals(), 3))).isEqualTo(first);
    }
  }

  @Test
  void shouldCoerceNonPositiveRequestToOne() {
    assertThat(discoveryService.discover(fourCategoricals(), 0).getRelationships()).hasSize(1);
    assertThat(discoveryService.discover(fourCategoricals(), -5).getRelationships()).hasSize(1);
  }

  @Test
  void shouldStopAtAvailableCombinations() {
    DiscoveryResult result = discoveryService.discover(TestFixtures.salesDataset(), 10);

    assertThat(columnsOf(result)).containsExactly(List.of("category", "region"));
  }

  @Test
  void shouldUseFrequencyTableForSingleCategoricalColumn() {
    TabularDataset data =
        dataset(List.of(text("team"), numeric("score")), List.of(row("red", 1L), row("blue", 2L)));

    DiscoveryResult result = discoveryService.discover(data, 3);

    assertThat(result.getRelationships()).hasSize(1);
    assertThat(result.getRelationships().get(0).isPair()).isFalse();
    assertThat(result.getRelationships().get(0).getTitle()).isEqualTo("team Frequency");
  }

  @Test
  void shouldFallBackToFirstNumericColumn() {
    TabularDataset data =
        dataset(
            List.of(new DatasetColumn("day", ColumnKind.DATETIME), numeric("a"), numeric("b")),
            List.of(row(LocalDate.of(2024, 1, 1), 1L, 2L)));

    DiscoveryResult result = discoveryService.discover(data, 2);

    assertThat(columnsOf(result)).containsExactly(List.of("a"));
  }

  @Test
  void shouldFailWhenNoCategoricalOrNumericColumnRemains() {
    TabularDataset data =
        dataset(
            List.of(new DatasetColumn("day", ColumnKind.DATETIME)),
            List.of(row(LocalDate.of(2024, 1, 1))));

    assertThatThrownBy(() -> discoveryService.discover(data, 1))
        .isInstanceOf(NoUsableColumnsException.class)
        .hasMessageContaining("day");
  }

  @Test
  void shouldFlagDatetimeLikeColumnsByKindOrNameSubstring() {
    TabularDataset data =
        dataset(
            List.of(
                text("Update_Date"),
                numeric("lifetime_value"),
                new DatasetColumn("created", ColumnKind.DATETIME),
                text("city")),
            List.of(row("x", 1L, LocalDate.of(2024, 1, 1), "Oslo")));

    List<ColumnProfile> profiles = discoveryService.profile(data);

    assertThat(profiles)
        .extracting(ColumnProfile::isDatetimeLike)
        .containsExactly(true, true, true, false);
    assertThat(profiles)
        .extracting(ColumnProfile::getRole)
        .containsExactly(
            ColumnRole.CATEGORICAL,
            ColumnRole.NUMERIC,
            ColumnRole.DATETIME_LIKE,
            ColumnRole.CATEGORICAL);
  }

  @Test
  void shouldKeepDatetimeLikeTextColumnsCategorical() {
    TabularDataset data =
        dataset(
            List.of(text("shift_time"), text("city")),
            List.of(row("am", "Oslo"), row("pm", "Rome")));

    assertThat(columnsOf(discoveryService.discover(data, 1)))
        .containsExactly(List.of("shift_time", "city"));
  }

  @Test
  void shouldPairDateValuedTextColumnsAsCategorical() {
    List<List<Object>> rows = new ArrayList<>();
    String[] regions = {"North", "South", "East"};
    for (int day = 1; day <= 12; day++) {
      rows.add(row(String.format("2024-01-%02d", day), regions[day % 3]));
    }
    TabularDataset data =
        dataset(
            List.of(new DatasetColumn("order_day", ColumnKind.TEXT, true), text("region")), rows);

    DiscoveryResult result = discoveryService.discover(data, 1);

    assertThat(result.getRelationships().get(0).getTitle()).isEqualTo("order_day vs region");
    ColumnProfile orderDay = result.getProfiles().get(0);
    assertThat(orderDay.isDatetimeLike()).isTrue();
    assertThat(orderDay.getRole()).isEqualTo(ColumnRole.CATEGORICAL);
  }
}
