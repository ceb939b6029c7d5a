package com.dataflow.pipeline.dto.cleaning;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.dataflow.pipeline.service.data_processing.DropIncompleteRowsStrategy;
import com.dataflow.pipeline.service.data_processing.MissingValueStrategy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Cleaning options for one request. Fully empty rows and columns are always dropped and empty
 * strings always count as missing; what happens to the remaining missing cells is decided by the
 * {@link MissingValueStrategy}.
 */
@Value
@Builder
public class CleaningPolicy {

  /** Dropped when present; unknown names are ignored. */
  @NonNull @Builder.Default Set<String> columnsToRemove = Collections.emptySet();

  @NonNull @Builder.Default
  MissingValueStrategy missingValueStrategy = new DropIncompleteRowsStrategy();

  public static CleaningPolicy defaults() {
    return CleaningPolicy.builder().build();
  }

  /** Parses a comma-separated removal list such as {@code "id, notes"}. Blank entries are skipped. */
  public static Set<String> parseRemovalList(String removeFields) {
    if (removeFields == null || removeFields.trim().isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> names = new LinkedHashSet<>();
    Arrays.stream(removeFields.split(","))
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .forEach(names::add);
    return Collections.unmodifiableSet(names);
  }
}
