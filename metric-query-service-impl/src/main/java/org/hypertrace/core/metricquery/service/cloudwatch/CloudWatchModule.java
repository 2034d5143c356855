package org.hypertrace.core.metricquery.service.cloudwatch;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import io.micrometer.core.instrument.MeterRegistry;
import org.hypertrace.core.metricquery.service.RequestHandlerBuilder;
import org.hypertrace.core.metricquery.service.RequestHandlerClientConfigRegistry;

public class CloudWatchModule extends AbstractModule {

  @Override
  protected void configure() {
    Multibinder.newSetBinder(binder(), RequestHandlerBuilder.class)
        .addBinding()
        .to(CloudWatchRequestHandlerBuilder.class);
    requireBinding(RequestHandlerClientConfigRegistry.class);
    requireBinding(MeterRegistry.class);
  }
}
