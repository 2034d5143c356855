package org.hypertrace.core.metricquery.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metricquery.service.api.MetricQueryRequest;
import org.hypertrace.core.metricquery.service.api.MetricQueryResponse;

@Singleton
@Slf4j
public class QueryServiceImpl {

  private static final String SERVICE_REQUESTS_STATUS_COUNTER =
      "hypertrace.metric.query.service.requests.status";

  private final RequestHandlerSelector handlerSelector;
  private final Counter requestStatusErrorCounter;
  private final Counter requestStatusSuccessCounter;

  @Inject
  QueryServiceImpl(RequestHandlerSelector handlerSelector, MeterRegistry meterRegistry) {
    this.handlerSelector = handlerSelector;
    this.requestStatusErrorCounter =
        Counter.builder(SERVICE_REQUESTS_STATUS_COUNTER)
            .tag("error", "true")
            .register(meterRegistry);
    this.requestStatusSuccessCounter =
        Counter.builder(SERVICE_REQUESTS_STATUS_COUNTER)
            .tag("error", "false")
            .register(meterRegistry);
  }

  public Observable<MetricQueryResponse> execute(MetricQueryRequest request) {
    return Maybe.defer(() -> Maybe.fromOptional(this.handlerSelector.select(request)))
        .switchIfEmpty(
            Maybe.error(new IllegalStateException("No handler available matching request")))
        .flatMapObservable(handler -> handler.handleRequest(request))
        .doOnError(
            error -> {
              log.error(
                  "Query failed. region: {}, queries: {}",
                  request.getRegion(),
                  request.getQueries().size(),
                  error);
              requestStatusErrorCounter.increment();
            })
        .doOnComplete(requestStatusSuccessCounter::increment);
  }
}
