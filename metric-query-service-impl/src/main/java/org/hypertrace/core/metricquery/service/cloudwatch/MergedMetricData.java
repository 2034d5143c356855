package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.Map;
import java.util.Set;
import lombok.Value;
import org.hypertrace.core.metricquery.service.api.MetricDataResult;

/**
 * Result pages coalesced per query id and label, along with the ids of the queries whose pages
 * reported that the request exceeded the backend's metric limit.
 */
@Value
class MergedMetricData {
  /** query id -> label -> merged result, in order of first arrival */
  Map<String, Map<String, MetricDataResult>> resultsById;

  Set<String> exceededLimitQueryIds;

  boolean isRequestExceededMaxLimit(String queryId) {
    return exceededLimitQueryIds.contains(queryId);
  }
}
