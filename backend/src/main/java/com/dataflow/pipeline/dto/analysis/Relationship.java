package com.dataflow.pipeline.dto.analysis;

import java.util.List;

import lombok.Value;

/** A column pair (cross-tabulation) or a single column (frequency count) selected for a pivot. */
@Value
public class Relationship {

  List<String> columns;

  /** Position among all relationships selected for the request, starting at 0. */
  int position;

  public static Relationship pair(String rowColumn, String columnColumn, int position) {
    return new Relationship(List.of(rowColumn, columnColumn), position);
  }

  public static Relationship frequency(String column, int position) {
    return new Relationship(List.of(column), position);
  }

  public boolean isPair() {
    return columns.size() == 2;
  }

  public String getIndexColumn() {
    return columns.get(0);
  }

  public String getTitle() {
    return isPair() ? columns.get(0) + " vs " + columns.get(1) : columns.get(0) + " Frequency";
  }
}
