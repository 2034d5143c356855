package org.hypertrace.core.metricquery.service.api;

import java.util.List;
import java.util.Map;

/**
 * How a {@link MetricQuery} is answered by the monitoring backend. The kind decides how series
 * produced by the query get their display names.
 */
public enum QueryKind {
  /** A plain metric statistic over fully specified dimensions. */
  METRIC_STAT,
  /** A metric query answered with a search built from wildcard or fan-out dimensions. */
  INFERRED_SEARCH,
  /** A metric math expression over other queries. */
  MATH_EXPRESSION,
  /** A {@code SEARCH(...)} expression written by the user. */
  USER_DEFINED_SEARCH;

  static final String WILDCARD = "*";
  private static final String SEARCH_FUNCTION = "SEARCH(";

  static QueryKind classify(
      String expression, Map<String, List<String>> dimensions, boolean matchExact) {
    if (expression.contains(SEARCH_FUNCTION)) {
      return USER_DEFINED_SEARCH;
    }
    if (!expression.isEmpty()) {
      return MATH_EXPRESSION;
    }
    return isInferredSearch(dimensions, matchExact) ? INFERRED_SEARCH : METRIC_STAT;
  }

  private static boolean isInferredSearch(
      Map<String, List<String>> dimensions, boolean matchExact) {
    if (!matchExact) {
      return true;
    }
    return dimensions.values().stream()
        .anyMatch(values -> values.size() > 1 || values.contains(WILDCARD));
  }
}
