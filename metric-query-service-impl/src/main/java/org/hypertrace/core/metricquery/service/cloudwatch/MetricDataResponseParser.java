package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.metricquery.service.api.GetMetricDataOutput;
import org.hypertrace.core.metricquery.service.api.MetricDataResult;
import org.hypertrace.core.metricquery.service.api.MetricQuery;
import org.hypertrace.core.metricquery.service.api.MetricQueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MetricDataResponseParser {

  private static final Logger LOG = LoggerFactory.getLogger(MetricDataResponseParser.class);

  private MetricDataResponseParser() {}

  /**
   * Merges the result pages and formats the series of every query that got results. Responses are
   * ordered by query id. A query whose results can not be parsed gets a response carrying the
   * error; the other queries are not affected.
   *
   * @throws IllegalArgumentException if a page references a query id missing from {@code
   *     queriesById}
   */
  public static List<MetricQueryResponse> parse(
      List<GetMetricDataOutput> outputs, Map<String, MetricQuery> queriesById) {
    LOG.debug(
        "Parsing metric data output. pages: {}, queries: {}",
        outputs.size(),
        queriesById.keySet());
    MergedMetricData merged = MetricDataResultMerger.merge(outputs, queriesById);

    return merged.getResultsById().keySet().stream()
        .sorted()
        .map(
            id ->
                buildResponse(
                    queriesById.get(id),
                    merged.getResultsById().get(id),
                    merged.isRequestExceededMaxLimit(id)))
        .collect(Collectors.toUnmodifiableList());
  }

  private static MetricQueryResponse buildResponse(
      MetricQuery query, Map<String, MetricDataResult> resultsByLabel, boolean exceededMaxLimit) {
    MetricQueryResponse.MetricQueryResponseBuilder response =
        MetricQueryResponse.builder()
            .id(query.getId())
            .refId(query.getRefId())
            .expression(query.getExpression())
            .period(query.getPeriod())
            .requestExceededMaxLimit(exceededMaxLimit);
    try {
      FormattedSeries series = MetricDataSeriesFormatter.format(resultsByLabel, query);
      return response.frames(series.getFrames()).partialData(series.isPartialData()).build();
    } catch (QueryParsingException e) {
      LOG.warn("Failed to parse results of query: {}", query.getId(), e);
      return response.error(e.getMessage()).build();
    }
  }
}
