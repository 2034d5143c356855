package org.hypertrace.core.metricquery.service.api;

import com.google.common.base.Preconditions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A batch of metric queries together with the {@code GetMetricData} inputs the request builder
 * produced for them.
 */
@Value
@Builder
public class MetricQueryRequest {
  String region;
  @Singular List<MetricQuery> queries;
  @Singular List<GetMetricDataInput> inputs;

  public Map<String, MetricQuery> getQueriesById() {
    Map<String, MetricQuery> queriesById = new LinkedHashMap<>();
    for (MetricQuery query : queries) {
      Preconditions.checkArgument(
          queriesById.put(query.getId(), query) == null,
          "Duplicate query id in request: %s",
          query.getId());
    }
    return queriesById;
  }
}
