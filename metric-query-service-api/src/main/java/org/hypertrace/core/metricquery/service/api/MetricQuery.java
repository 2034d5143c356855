package org.hypertrace.core.metricquery.service.api;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A single metric query submitted to the monitoring backend, identified by an opaque {@code id}
 * that is stable across all result pages returned for it.
 *
 * <p>The {@link QueryKind} and the multi-valued dimension flag are derived once from the
 * expression and dimensions when the query is built.
 */
@Value
public class MetricQuery {
  String id;
  String refId;
  String region;
  String namespace;
  String metricName;
  /** Dimension name to candidate values, ordered by dimension name. */
  SortedMap<String, List<String>> dimensions;

  /** Expected sampling interval in seconds. */
  int period;

  String stat;
  String alias;
  String expression;
  boolean matchExact;
  boolean returnData;
  QueryKind kind;
  boolean multiValuedDimension;

  @Builder(toBuilder = true)
  private MetricQuery(
      String id,
      String refId,
      String region,
      String namespace,
      String metricName,
      @Singular Map<String, List<String>> dimensions,
      int period,
      String stat,
      String alias,
      String expression,
      Boolean matchExact,
      Boolean returnData) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "query id must be set");
    Preconditions.checkArgument(period > 0, "period of query %s must be positive: %s", id, period);
    this.id = id;
    this.refId = Strings.nullToEmpty(refId);
    this.region = Strings.nullToEmpty(region);
    this.namespace = Strings.nullToEmpty(namespace);
    this.metricName = Strings.nullToEmpty(metricName);
    this.period = period;
    this.stat = Strings.nullToEmpty(stat);
    this.alias = Strings.nullToEmpty(alias);
    this.expression = Strings.nullToEmpty(expression);
    this.matchExact = matchExact == null || matchExact;
    this.returnData = returnData == null || returnData;

    SortedMap<String, List<String>> sortedDimensions = new TreeMap<>();
    dimensions.forEach((name, values) -> sortedDimensions.put(name, List.copyOf(values)));
    this.dimensions = Collections.unmodifiableSortedMap(sortedDimensions);

    this.kind = QueryKind.classify(this.expression, this.dimensions, this.matchExact);
    this.multiValuedDimension = hasMultiValuedDimension(this.dimensions);
  }

  public boolean isMathExpression() {
    return kind == QueryKind.MATH_EXPRESSION;
  }

  public boolean isUserDefinedSearchExpression() {
    return kind == QueryKind.USER_DEFINED_SEARCH;
  }

  public boolean isInferredSearchExpression() {
    return kind == QueryKind.INFERRED_SEARCH;
  }

  public boolean isMultiValuedDimensionExpression() {
    return multiValuedDimension;
  }

  // the first wildcard dimension in name order wins over any later fan-out dimension
  private static boolean hasMultiValuedDimension(SortedMap<String, List<String>> dimensions) {
    for (List<String> values : dimensions.values()) {
      if (values.contains(QueryKind.WILDCARD)) {
        return false;
      }
      if (values.size() > 1) {
        return true;
      }
    }
    return false;
  }
}
