package com.dataflow.pipeline.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import java.util.Date;

/** Helpers shared by every stage that has to compare, label or classify raw cell values. */
public final class CellValues {

  /**
   * Orders cell values the way a sorted pivot axis reads: numbers first (numerically), then
   * date/time values (chronologically within the same type), then everything else by its text
   * label. Consistent with {@code equals}, so it can key sorted sets of mixed-type cells.
   */
  public static final Comparator<Object> NATURAL_ORDER = CellValues::compare;

  private CellValues() {}

  public static boolean isMissing(Object value) {
    return value == null;
  }

  public static boolean isEmptyText(Object value) {
    return value instanceof String && ((String) value).isEmpty();
  }

  public static boolean isTemporal(Object value) {
    return value instanceof TemporalAccessor || value instanceof Date;
  }

  /** Text label used for pivot headers, record keys and chart categories. */
  public static String label(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      return Double.toString(((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (isTemporal(value)) {
      return isoText(value);
    }
    return value.toString();
  }

  /** ISO-8601 text of a date or time value; other values are returned as {@code toString()}. */
  public static String isoText(Object value) {
    if (value instanceof LocalDateTime) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
    }
    if (value instanceof LocalDate) {
      return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
    }
    if (value instanceof LocalTime) {
      return DateTimeFormatter.ISO_LOCAL_TIME.format((LocalTime) value);
    }
    if (value instanceof OffsetDateTime) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value);
    }
    if (value instanceof ZonedDateTime) {
      return DateTimeFormatter.ISO_ZONED_DATE_TIME.format((ZonedDateTime) value);
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant().toString();
    }
    return String.valueOf(value);
  }

  private static int compare(Object left, Object right) {
    int order = compareByKind(left, right);
    if (order != 0 || left.equals(right)) {
      return order;
    }
    // Equal-looking values of different types, e.g. Boolean.TRUE and "true", stay distinct.
    order = left.getClass().getName().compareTo(right.getClass().getName());
    return order != 0 ? order : label(left).compareTo(label(right));
  }

  @SuppressWarnings("unchecked")
  private static int compareByKind(Object left, Object right) {
    int leftRank = rank(left);
    int rightRank = rank(right);
    if (leftRank != rightRank) {
      return Integer.compare(leftRank, rightRank);
    }
    if (left instanceof Number && right instanceof Number) {
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (leftRank == 1
        && left.getClass().equals(right.getClass())
        && left instanceof Comparable) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    return label(left).compareTo(label(right));
  }

  private static int rank(Object value) {
    if (value instanceof Number) {
      return 0;
    }
    if (isTemporal(value)) {
      return 1;
    }
    return 2;
  }
}
