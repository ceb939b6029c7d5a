package com.dataflow.pipeline.service.data_processing;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.cobber.fta.TextAnalysisResult;
import com.cobber.fta.TextAnalyzer;
import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.dto.dataset.ColumnKind;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Infers the declared kind of a delimited-text column with FTA and converts the raw cells to typed
 * values. Runs once per column at load time.
 *
 * <p>Only numbers and the literal {@code true}/{@code false} spellings get a non-text kind. Date
 * values and spellings such as {@code Yes}/{@code No} stay text, so they remain available as
 * categorical axes; date-valued columns are flagged as temporal instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnKindDetector {

  private static final Set<String> TRUE_TOKENS = Set.of("True", "TRUE", "true");
  private static final Set<String> FALSE_TOKENS = Set.of("False", "FALSE", "false");
  private static final Set<String> TEMPORAL_BASE_TYPES =
      Set.of("LOCALDATE", "LOCALTIME", "LOCALDATETIME", "ZONEDDATETIME", "OFFSETDATETIME");

  private final ApplicationProperties properties;

  /** Result of typing one column: its kind and the converted cells, missing cells kept as null. */
  @Getter
  @AllArgsConstructor
  public static class TypedColumn {
    private final ColumnKind kind;
    private final List<Object> values;
    private final boolean temporalValues;
  }

  public TypedColumn detect(String columnName, List<String> rawValues) {
    if (rawValues.stream().allMatch(v -> v == null)) {
      return new TypedColumn(ColumnKind.UNKNOWN, new ArrayList<>(rawValues), false);
    }
    if (isLiteralBooleanColumn(rawValues)) {
      return new TypedColumn(ColumnKind.UNKNOWN, toBooleans(rawValues), false);
    }

    String baseType = analyze(columnName, rawValues);
    switch (baseType) {
      case "LONG":
      case "DOUBLE":
      case "BOOLEAN":
        return numericOrText(columnName, rawValues);
      default:
        return new TypedColumn(
            ColumnKind.TEXT, new ArrayList<>(rawValues), TEMPORAL_BASE_TYPES.contains(baseType));
    }
  }

  private TypedColumn numericOrText(String columnName, List<String> rawValues) {
    List<Object> numbers = parseNumbers(rawValues);
    if (numbers != null) {
      return new TypedColumn(ColumnKind.NUMERIC, numbers, false);
    }
    log.debug(
        "Column '{}' has values that are not numbers, keeping it as text", columnName);
    return new TypedColumn(ColumnKind.TEXT, new ArrayList<>(rawValues), false);
  }

  /** FTA base type name; {@code LONG} or {@code STRING} from a plain parse when FTA fails. */
  private String analyze(String columnName, List<String> rawValues) {
    try {
      TextAnalyzer analyzer = new TextAnalyzer(columnName);
      analyzer.setDetectWindow(properties.getLoader().getDetectWindow());
      for (String value : rawValues) {
        analyzer.train(value);
      }
      TextAnalysisResult result = analyzer.getResult();
      String baseType = result.getType() == null ? "STRING" : result.getType().name();
      log.debug("Column '{}': FTA base type {}", columnName, baseType);
      return baseType;
    } catch (Exception e) {
      log.warn(
          "FTA analysis failed for column '{}': {}. Falling back to numeric parse check.",
          columnName,
          e.getMessage());
      return parseNumbers(rawValues) != null ? "LONG" : "STRING";
    }
  }

  static boolean isLiteralBooleanColumn(List<String> rawValues) {
    return rawValues.stream()
        .allMatch(v -> v == null || TRUE_TOKENS.contains(v) || FALSE_TOKENS.contains(v));
  }

  private static List<Object> toBooleans(List<String> rawValues) {
    List<Object> values = new ArrayList<>(rawValues.size());
    for (String raw : rawValues) {
      values.add(raw == null ? null : Boolean.valueOf(TRUE_TOKENS.contains(raw)));
    }
    return values;
  }

  /**
   * Converts every present value to a number, or returns null if any value is not one. The column
   * stays integral ({@code Long}) only when every value is; otherwise all values become {@code
   * Double}.
   */
  static List<Object> parseNumbers(List<String> rawValues) {
    List<Object> parsed = new ArrayList<>(rawValues.size());
    boolean integral = true;
    for (String raw : rawValues) {
      if (raw == null) {
        parsed.add(null);
        continue;
      }
      String trimmed = raw.trim();
      try {
        parsed.add(Long.parseLong(trimmed));
      } catch (NumberFormatException notLong) {
        try {
          double value = Double.parseDouble(trimmed);
          if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
          }
          parsed.add(value);
          integral = false;
        } catch (NumberFormatException notDouble) {
          return null;
        }
      }
    }
    if (!integral) {
      for (int i = 0; i < parsed.size(); i++) {
        Object value = parsed.get(i);
        if (value instanceof Long) {
          parsed.set(i, ((Long) value).doubleValue());
        }
      }
    }
    return parsed;
  }
}
