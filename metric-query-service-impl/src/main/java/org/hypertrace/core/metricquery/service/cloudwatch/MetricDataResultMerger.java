package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hypertrace.core.metricquery.service.api.GetMetricDataOutput;
import org.hypertrace.core.metricquery.service.api.MessageData;
import org.hypertrace.core.metricquery.service.api.MetricDataResult;
import org.hypertrace.core.metricquery.service.api.MetricQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces the fragments of all result pages that belong to the same (query id, label) pair.
 *
 * <p>Data points of a continued fragment are appended in page order without resorting. A merged
 * fragment is complete as soon as any of its pages was complete.
 */
class MetricDataResultMerger {

  private static final Logger LOG = LoggerFactory.getLogger(MetricDataResultMerger.class);

  private MetricDataResultMerger() {}

  /**
   * @param outputs result pages in arrival order
   * @param queriesById the submitted queries keyed by their id
   * @throws IllegalArgumentException if a page holds a result for a query id that was not
   *     submitted; nothing is merged in that case
   */
  static MergedMetricData merge(
      List<GetMetricDataOutput> outputs, Map<String, MetricQuery> queriesById) {
    Map<String, Map<String, MetricDataResult>> resultsById = new LinkedHashMap<>();
    Set<String> exceededLimitQueryIds = new LinkedHashSet<>();

    for (GetMetricDataOutput output : outputs) {
      boolean exceededMaxLimit = output.hasMessage(MessageData.MAX_METRICS_EXCEEDED);
      for (MetricDataResult result : output.getMetricDataResults()) {
        String queryId = result.getId();
        if (!queriesById.containsKey(queryId)) {
          throw new IllegalArgumentException(
              "Metric data result references an unknown query id: " + queryId);
        }
        LOG.debug(
            "Merging metric data result. id: {}, label: {}, points: {}, status: {}",
            queryId,
            result.getLabel(),
            result.getTimestamps().size(),
            result.getStatusCode());
        resultsById
            .computeIfAbsent(queryId, id -> new LinkedHashMap<>())
            .merge(result.getLabel(), result, MetricDataResultMerger::append);
        if (exceededMaxLimit) {
          exceededLimitQueryIds.add(queryId);
        }
      }
    }

    Map<String, Map<String, MetricDataResult>> merged = new LinkedHashMap<>();
    resultsById.forEach((id, byLabel) -> merged.put(id, Collections.unmodifiableMap(byLabel)));
    return new MergedMetricData(
        Collections.unmodifiableMap(merged), Collections.unmodifiableSet(exceededLimitQueryIds));
  }

  static MetricDataResult append(MetricDataResult existing, MetricDataResult continuation) {
    return existing.toBuilder()
        .timestamps(continuation.getTimestamps())
        .values(continuation.getValues())
        .messages(continuation.getMessages())
        .statusCode(
            continuation.isComplete() ? continuation.getStatusCode() : existing.getStatusCode())
        .build();
  }
}
