package org.hypertrace.core.metricquery.service.cloudwatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.hypertrace.core.metricquery.service.api.DataFrame;
import org.hypertrace.core.metricquery.service.api.DataFrame.DataFrameBuilder;
import org.hypertrace.core.metricquery.service.api.MessageData;
import org.hypertrace.core.metricquery.service.api.MetricDataResult;
import org.hypertrace.core.metricquery.service.api.MetricQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the merged results of one query into data frames, one per label in label order.
 *
 * <p>A query whose results carry no values and whose dimensions fan out into several values gets
 * one empty frame per value of the widest dimension instead, so every expected series still shows
 * up under its own name.
 */
class MetricDataSeriesFormatter {

  private static final Logger LOG = LoggerFactory.getLogger(MetricDataSeriesFormatter.class);

  private MetricDataSeriesFormatter() {}

  /**
   * @throws QueryParsingException if any result reports an arithmetic error
   */
  static FormattedSeries format(Map<String, MetricDataResult> resultsByLabel, MetricQuery query) {
    List<String> labels = new ArrayList<>(resultsByLabel.keySet());
    Collections.sort(labels);
    LOG.debug("Formatting metric data results. query: {}, labels: {}", query.getId(), labels);

    boolean partialData = false;
    List<DataFrame> frames = new ArrayList<>();
    for (String label : labels) {
      MetricDataResult result = resultsByLabel.get(label);
      if (!result.isComplete()) {
        LOG.debug(
            "Handling a partial result. query: {}, label: {}, status: {}",
            query.getId(),
            label,
            result.getStatusCode());
        partialData = true;
      }

      for (MessageData message : result.getMessages()) {
        if (message.hasCode(MessageData.ARITHMETIC_ERROR)) {
          throw new QueryParsingException(
              query.getRefId(),
              String.format(
                  "ArithmeticError in query \"%s\": %s", query.getRefId(), message.getValue()));
        }
      }

      if (result.getValues().isEmpty() && query.isMultiValuedDimensionExpression()) {
        for (SortedMap<String, String> tags : DimensionTagResolver.fanOutTags(query)) {
          frames.add(
              DataFrame.builder()
                  .name(AliasFormatter.format(query, query.getStat(), tags, label))
                  .tags(tags)
                  .build());
        }
      } else {
        SortedMap<String, String> tags = DimensionTagResolver.resolveTags(query, label);
        DataFrameBuilder frame =
            DataFrame.builder()
                .name(AliasFormatter.format(query, query.getStat(), tags, label))
                .tags(tags);
        fillGaps(result.getTimestamps(), result.getValues(), query.getPeriod(), frame);
        frames.add(frame.build());
      }
    }
    return new FormattedSeries(Collections.unmodifiableList(frames), partialData);
  }

  /**
   * Copies the points into the frame. Where a point arrives later than one period after its
   * predecessor, a single null point is inserted one period after the predecessor.
   */
  static void fillGaps(
      List<Instant> timestamps, List<Double> values, int periodSeconds, DataFrameBuilder frame) {
    for (int i = 0; i < timestamps.size(); i++) {
      Instant timestamp = timestamps.get(i);
      if (i > 0) {
        Instant expected = timestamps.get(i - 1).plusSeconds(periodSeconds);
        if (expected.isBefore(timestamp)) {
          frame.timestamp(expected.toEpochMilli()).value(null);
        }
      }
      frame.timestamp(timestamp.toEpochMilli()).value(values.get(i));
    }
  }
}
