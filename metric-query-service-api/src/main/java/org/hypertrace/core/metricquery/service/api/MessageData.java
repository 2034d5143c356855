package org.hypertrace.core.metricquery.service.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A diagnostic message attached to a result page or to a single result. */
@Value
@Jacksonized
@Builder
public class MessageData {
  public static final String ARITHMETIC_ERROR = "ArithmeticError";
  public static final String MAX_METRICS_EXCEEDED = "MaxMetricsExceeded";

  @JsonProperty("Code")
  String code;

  @JsonProperty("Value")
  String value;

  public static MessageData of(String code, String value) {
    return MessageData.builder().code(code).value(value).build();
  }

  public boolean hasCode(String expectedCode) {
    return expectedCode.equals(code);
  }
}
