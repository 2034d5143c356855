package org.hypertrace.core.metricquery.service;

import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.metricquery.service.api.MetricQueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RequestHandlerSelector {

  private static final Logger LOG = LoggerFactory.getLogger(RequestHandlerSelector.class);

  private final RequestHandlerRegistry registry;

  @Inject
  public RequestHandlerSelector(RequestHandlerRegistry registry) {
    this.registry = registry;
  }

  public Optional<RequestHandler> select(MetricQueryRequest request) {

    // ask every handler for the cost of serving the request and keep the cheapest one
    double minCost = Double.MAX_VALUE;
    RequestHandler selectedHandler = null;
    for (RequestHandler requestHandler : registry.getAll()) {
      QueryCost queryCost = requestHandler.canHandle(request);
      double cost = queryCost.getCost();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Request handler: {}, query cost: {}", requestHandler.getName(), cost);
      }
      if (queryCost.isSupported() && cost < minCost) {
        minCost = cost;
        selectedHandler = requestHandler;
      }
    }

    if (selectedHandler != null) {
      LOG.debug(
          "Selected requestHandler: {} for region: {}, queries: {}, cost: {}",
          selectedHandler.getName(),
          request.getRegion(),
          request.getQueries().size(),
          minCost);
    } else {
      LOG.error(
          "No requestHandler for region: {}, queries: {}",
          request.getRegion(),
          request.getQueries().size());
    }
    return Optional.ofNullable(selectedHandler);
  }
}
