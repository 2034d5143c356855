package org.hypertrace.core.metricquery.service;

import org.hypertrace.core.metricquery.service.QueryServiceConfig.RequestHandlerConfig;

public interface RequestHandlerBuilder {

  boolean canBuild(RequestHandlerConfig config);

  RequestHandler build(RequestHandlerConfig config);
}
