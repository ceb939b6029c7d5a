package com.dataflow.pipeline.service.analysis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.dto.analysis.Relationship;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.dto.pivot.PivotRow;
import com.dataflow.pipeline.dto.pivot.PivotTable;
import com.dataflow.pipeline.util.CellValues;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class PivotTableBuilderService {

  public List<PivotTable> buildAll(TabularDataset dataset, List<Relationship> relationships) {
    List<PivotTable> pivots = new ArrayList<>(relationships.size());
    for (Relationship relationship : relationships) {
      pivots.add(build(dataset, relationship));
    }
    return pivots;
  }

  public PivotTable build(TabularDataset dataset, Relationship relationship) {
    PivotTable pivot =
        relationship.isPair()
            ? crossTabulate(dataset, relationship)
            : frequencies(dataset, relationship);
    log.debug(
        "Pivot '{}': {} rows x {} headers, total {}",
        pivot.getTitle(),
        pivot.getRows().size(),
        pivot.getHeaders().size(),
        pivot.total());
    return pivot;
  }

  /** Rows and headers are the sorted distinct values; absent combinations count 0. */
  PivotTable crossTabulate(TabularDataset dataset, Relationship relationship) {
    int rowColumn = dataset.indexOf(relationship.getColumns().get(0));
    int headerColumn = dataset.indexOf(relationship.getColumns().get(1));

    TreeSet<Object> rowValues = new TreeSet<>(CellValues.NATURAL_ORDER);
    TreeSet<Object> headerValues = new TreeSet<>(CellValues.NATURAL_ORDER);
    Map<Object, Map<Object, Long>> counts = new HashMap<>();
    for (List<Object> row : dataset.getRows()) {
      Object rowValue = row.get(rowColumn);
      Object headerValue = row.get(headerColumn);
      if (CellValues.isMissing(rowValue) || CellValues.isMissing(headerValue)) {
        continue;
      }
      rowValues.add(rowValue);
      headerValues.add(headerValue);
      counts.computeIfAbsent(rowValue, k -> new HashMap<>()).merge(headerValue, 1L, Long::sum);
    }

    PivotTable.PivotTableBuilder builder =
        PivotTable.builder()
            .title(relationship.getTitle())
            .indexColumn(relationship.getColumns().get(0))
            .columnAxis(relationship.getColumns().get(1));
    for (Object headerValue : headerValues) {
      builder.header(CellValues.label(headerValue));
    }
    for (Object rowValue : rowValues) {
      Map<Object, Long> rowCounts = counts.get(rowValue);
      List<Long> cells = new ArrayList<>(headerValues.size());
      for (Object headerValue : headerValues) {
        cells.add(rowCounts.getOrDefault(headerValue, 0L));
      }
      builder.row(new PivotRow(rowValue, CellValues.label(rowValue), cells));
    }
    return builder.build();
  }

  /** Single "Count" header; rows by descending count, ties in first-appearance order. */
  PivotTable frequencies(TabularDataset dataset, Relationship relationship) {
    int column = dataset.indexOf(relationship.getIndexColumn());

    Map<Object, Long> counts = new LinkedHashMap<>();
    for (List<Object> row : dataset.getRows()) {
      Object value = row.get(column);
      if (!CellValues.isMissing(value)) {
        counts.merge(value, 1L, Long::sum);
      }
    }
    List<Map.Entry<Object, Long>> ordered = new ArrayList<>(counts.entrySet());
    ordered.sort(Map.Entry.<Object, Long>comparingByValue().reversed());

    PivotTable.PivotTableBuilder builder =
        PivotTable.builder()
            .title(relationship.getTitle())
            .indexColumn(relationship.getIndexColumn())
            .header(PivotTable.COUNT_HEADER);
    for (Map.Entry<Object, Long> entry : ordered) {
      builder.row(
          new PivotRow(entry.getKey(), CellValues.label(entry.getKey()), List.of(entry.getValue())));
    }
    return builder.build();
  }
}
