package org.hypertrace.core.metricquery.service.api;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** The parsed result of one {@link MetricQuery}. */
@Value
@Builder
public class MetricQueryResponse {
  String id;
  String refId;
  String expression;
  int period;
  @Singular List<DataFrame> frames;
  boolean partialData;
  boolean requestExceededMaxLimit;
  String error;

  /** Present when the query failed as a whole; frames are empty in that case. */
  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }
}
