package org.hypertrace.core.metricquery.service.cloudwatch;

/** Thrown when the results of a query can not be turned into series at all. */
public class QueryParsingException extends RuntimeException {

  private final String refId;

  public QueryParsingException(String refId, String reason) {
    super(String.format("error parsing query \"%s\", %s", refId, reason));
    this.refId = refId;
  }

  public String getRefId() {
    return refId;
  }
}
