package org.hypertrace.core.metricquery.service;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;

public class QueryServiceFactory {

  public static QueryServiceImpl build(Config config, MeterRegistry meterRegistry) {
    return Guice.createInjector(new QueryServiceModule(config, meterRegistry))
        .getInstance(QueryServiceImpl.class);
  }
}
