package org.hypertrace.core.metricquery.service;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import org.hypertrace.core.metricquery.service.cloudwatch.CloudWatchModule;

class QueryServiceModule extends AbstractModule {

  private final QueryServiceConfig config;
  private final MeterRegistry meterRegistry;

  QueryServiceModule(Config config, MeterRegistry meterRegistry) {
    this.config = new QueryServiceConfig(config);
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected void configure() {
    bind(QueryServiceConfig.class).toInstance(this.config);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    Multibinder.newSetBinder(binder(), RequestHandlerBuilder.class);
    install(new CloudWatchModule());
  }
}
