package org.hypertrace.core.metricquery.service;

import io.reactivex.rxjava3.core.Observable;
import org.hypertrace.core.metricquery.service.api.MetricQueryRequest;
import org.hypertrace.core.metricquery.service.api.MetricQueryResponse;

/**
 * Interface to be implemented by the handlers which fetch and parse the metric queries coming into
 * the service. Different implementations may front different monitoring endpoints or regions.
 *
 * <p>The callers of this will be first checking if the handler can handle the given request, and
 * can decide whether they want this handler to handle it.
 */
public interface RequestHandler {

  String getName();

  QueryCost canHandle(MetricQueryRequest request);

  /** Emits one response per query id that produced results. */
  Observable<MetricQueryResponse> handleRequest(MetricQueryRequest request);
}
