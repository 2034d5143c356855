package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.OptionalInt;

/** Thrown when fetching a result page from the monitoring endpoint fails. */
public class CloudWatchClientException extends RuntimeException {

  private final OptionalInt statusCode;

  CloudWatchClientException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = OptionalInt.empty();
  }

  CloudWatchClientException(int statusCode, String message) {
    super(message);
    this.statusCode = OptionalInt.of(statusCode);
  }

  /** HTTP status of the failed page, absent when no response was received. */
  public OptionalInt getStatusCode() {
    return statusCode;
  }
}
