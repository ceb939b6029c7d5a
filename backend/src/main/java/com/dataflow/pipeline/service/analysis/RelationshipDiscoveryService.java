package com.dataflow.pipeline.service.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.dto.analysis.ColumnProfile;
import com.dataflow.pipeline.dto.analysis.ColumnRole;
import com.dataflow.pipeline.dto.analysis.DiscoveryResult;
import com.dataflow.pipeline.dto.analysis.Relationship;
import com.dataflow.pipeline.dto.dataset.ColumnKind;
import com.dataflow.pipeline.dto.dataset.DatasetColumn;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.exception.NoUsableColumnsException;

import lombok.extern.slf4j.Slf4j;

/**
 * Profiles the cleaned columns and picks the relationships to summarize.
 *
 * <p>Selection, first rule that applies:
 *
 * <ol>
 *   <li>two or more categorical columns: rank them by distinct-value count (descending, ties in
 *       column order), enumerate 2-combinations in ranked order and keep the first {@code
 *       max(1, requested)};
 *   <li>exactly one categorical column: its frequency table;
 *   <li>otherwise the frequency table of the first numeric column;
 *   <li>nothing usable: {@link NoUsableColumnsException}.
 * </ol>
 */
@Slf4j
@Service
public class RelationshipDiscoveryService {

  public DiscoveryResult discover(TabularDataset dataset, int requestedRelations) {
    List<ColumnProfile> profiles = profile(dataset);
    List<Relationship> relationships = select(profiles, requestedRelations);
    log.info(
        "Selected {} relationship(s) of {} requested: {}",
        relationships.size(),
        Math.max(1, requestedRelations),
        relationships.stream().map(Relationship::getTitle).collect(Collectors.toList()));
    return new DiscoveryResult(profiles, relationships);
  }

  public List<ColumnProfile> profile(TabularDataset dataset) {
    List<ColumnProfile> profiles = new ArrayList<>(dataset.columnCount());
    for (int c = 0; c < dataset.columnCount(); c++) {
      DatasetColumn column = dataset.getColumns().get(c);
      Set<Object> distinct = new HashSet<>();
      for (Object value : dataset.columnValues(c)) {
        if (value != null) {
          distinct.add(value);
        }
      }
      profiles.add(
          ColumnProfile.builder()
              .name(column.getName())
              .kind(column.getKind())
              .role(roleOf(column.getKind()))
              .datetimeLike(isDatetimeLike(column))
              .distinctValues(distinct.size())
              .build());
    }
    return profiles;
  }

  List<Relationship> select(List<ColumnProfile> profiles, int requestedRelations) {
    int limit = Math.max(1, requestedRelations);

    List<ColumnProfile> categorical =
        profiles.stream()
            .filter(p -> p.getRole() == ColumnRole.CATEGORICAL)
            .sorted(Comparator.comparingInt(ColumnProfile::getDistinctValues).reversed())
            .collect(Collectors.toList());

    if (categorical.size() >= 2) {
      List<Relationship> relationships = new ArrayList<>();
      for (int i = 0; i < categorical.size() && relationships.size() < limit; i++) {
        for (int j = i + 1; j < categorical.size() && relationships.size() < limit; j++) {
          relationships.add(
              Relationship.pair(
                  categorical.get(i).getName(),
                  categorical.get(j).getName(),
                  relationships.size()));
        }
      }
      return relationships;
    }

    if (categorical.size() == 1) {
      return List.of(Relationship.frequency(categorical.get(0).getName(), 0));
    }

    return profiles.stream()
        .filter(p -> p.getRole() == ColumnRole.NUMERIC)
        .findFirst()
        .map(p -> List.of(Relationship.frequency(p.getName(), 0)))
        .orElseThrow(
            () ->
                new NoUsableColumnsException(
                    "No usable columns to generate relationships. Remaining columns: "
                        + profiles.stream()
                            .map(ColumnProfile::getName)
                            .collect(Collectors.toList())));
  }

  static ColumnRole roleOf(ColumnKind kind) {
    switch (kind) {
      case TEXT:
        return ColumnRole.CATEGORICAL;
      case NUMERIC:
        return ColumnRole.NUMERIC;
      case DATETIME:
        return ColumnRole.DATETIME_LIKE;
      default:
        return ColumnRole.UNKNOWN;
    }
  }

  /**
   * Date-valued columns, plus any name containing "date" or "time", including names like
   * "lifetime_value".
   */
  static boolean isDatetimeLike(DatasetColumn column) {
    if (column.getKind() == ColumnKind.DATETIME || column.isTemporalValues()) {
      return true;
    }
    String name = column.getName().toLowerCase(Locale.ROOT);
    return name.contains("date") || name.contains("time");
  }
}
