package org.hypertrace.core.metricquery.service.cloudwatch;

import io.micrometer.core.instrument.MeterRegistry;
import javax.inject.Inject;
import org.hypertrace.core.metricquery.service.QueryServiceConfig.RequestHandlerClientConfig;
import org.hypertrace.core.metricquery.service.QueryServiceConfig.RequestHandlerConfig;
import org.hypertrace.core.metricquery.service.RequestHandler;
import org.hypertrace.core.metricquery.service.RequestHandlerBuilder;
import org.hypertrace.core.metricquery.service.RequestHandlerClientConfigRegistry;

public class CloudWatchRequestHandlerBuilder implements RequestHandlerBuilder {

  private final RequestHandlerClientConfigRegistry clientConfigRegistry;
  private final CloudWatchRestClientFactory cloudWatchRestClientFactory;
  private final MeterRegistry meterRegistry;

  @Inject
  CloudWatchRequestHandlerBuilder(
      RequestHandlerClientConfigRegistry clientConfigRegistry,
      CloudWatchRestClientFactory cloudWatchRestClientFactory,
      MeterRegistry meterRegistry) {
    this.clientConfigRegistry = clientConfigRegistry;
    this.cloudWatchRestClientFactory = cloudWatchRestClientFactory;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public boolean canBuild(RequestHandlerConfig config) {
    return "cloudwatch".equals(config.getType());
  }

  @Override
  public RequestHandler build(RequestHandlerConfig config) {

    RequestHandlerClientConfig clientConfig =
        this.clientConfigRegistry
            .get(config.getClientConfig())
            .orElseThrow(
                () ->
                    new UnsupportedOperationException(
                        "Client config requested but not registered: " + config.getClientConfig()));

    return new CloudWatchBasedRequestHandler(
        config.getName(),
        config.getRequestHandlerInfo(),
        cloudWatchRestClientFactory.getCloudWatchClient(clientConfig),
        meterRegistry);
  }
}
