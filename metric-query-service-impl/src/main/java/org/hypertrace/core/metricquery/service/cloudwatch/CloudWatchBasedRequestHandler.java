package org.hypertrace.core.metricquery.service.cloudwatch;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Observable;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.metricquery.service.ConfigUtils;
import org.hypertrace.core.metricquery.service.QueryCost;
import org.hypertrace.core.metricquery.service.RequestHandler;
import org.hypertrace.core.metricquery.service.api.GetMetricDataOutput;
import org.hypertrace.core.metricquery.service.api.MetricQuery;
import org.hypertrace.core.metricquery.service.api.MetricQueryRequest;
import org.hypertrace.core.metricquery.service.api.MetricQueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CloudWatchBasedRequestHandler implements RequestHandler {

  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchBasedRequestHandler.class);

  private static final String REGION_CONFIG_KEY = "region";
  private static final String COST_CONFIG_KEY = "cost";
  private static final String ANY_REGION = "*";
  private static final double DEFAULT_COST = 0.5;

  private static final String RESPONSES_COUNTER = "hypertrace.metric.query.cloudwatch.responses";

  private final String name;
  private final CloudWatchRestClient cloudWatchRestClient;

  private String region;
  private double cost;

  private final Counter partialDataCounter;
  private final Counter exceededLimitCounter;
  private final Counter errorCounter;

  CloudWatchBasedRequestHandler(
      String name,
      Config requestHandlerConfig,
      CloudWatchRestClient cloudWatchRestClient,
      MeterRegistry meterRegistry) {
    this.name = name;
    this.processConfig(requestHandlerConfig);
    this.cloudWatchRestClient = cloudWatchRestClient;
    this.partialDataCounter = registerResponseCounter(meterRegistry, "partial_data");
    this.exceededLimitCounter = registerResponseCounter(meterRegistry, "exceeded_limit");
    this.errorCounter = registerResponseCounter(meterRegistry, "error");
  }

  @Override
  public String getName() {
    return name;
  }

  private void processConfig(Config config) {
    if (!config.hasPath(REGION_CONFIG_KEY)) {
      throw new RuntimeException(
          REGION_CONFIG_KEY + " is not defined in the " + name + " request handler.");
    }
    this.region = config.getString(REGION_CONFIG_KEY);
    this.cost = ConfigUtils.getDoubleOrDefault(config, COST_CONFIG_KEY, DEFAULT_COST);
  }

  /** A handler serves the requests of its own region, or of every region if configured with "*". */
  @Override
  public QueryCost canHandle(MetricQueryRequest request) {
    if (ANY_REGION.equals(region) || region.equals(request.getRegion())) {
      return new QueryCost(cost);
    }
    return QueryCost.UNSUPPORTED;
  }

  @Override
  public Observable<MetricQueryResponse> handleRequest(MetricQueryRequest request) {
    Preconditions.checkNotNull(request);
    Preconditions.checkArgument(
        !request.getInputs().isEmpty(), "request without metric data inputs");
    Map<String, MetricQuery> queriesById = request.getQueriesById();

    return Observable.defer(
            () -> {
              List<GetMetricDataOutput> outputs =
                  cloudWatchRestClient.executeAll(request.getInputs());
              LOG.debug("Fetched {} metric data pages for handler: {}", outputs.size(), name);
              return Observable.fromIterable(
                  MetricDataResponseParser.parse(outputs, queriesById));
            })
        .doOnNext(this::recordResponse)
        .doOnNext(response -> LOG.debug("collect a response: {}", response.getRefId()));
  }

  private void recordResponse(MetricQueryResponse response) {
    if (response.getError().isPresent()) {
      errorCounter.increment();
    }
    if (response.isPartialData()) {
      partialDataCounter.increment();
    }
    if (response.isRequestExceededMaxLimit()) {
      exceededLimitCounter.increment();
    }
  }

  private Counter registerResponseCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder(RESPONSES_COUNTER)
        .tag("handler", name)
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
