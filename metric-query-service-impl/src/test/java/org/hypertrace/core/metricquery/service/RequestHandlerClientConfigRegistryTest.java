package org.hypertrace.core.metricquery.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RequestHandlerClientConfigRegistryTest {
  private final QueryServiceConfig config =
      new QueryServiceConfig(QueryServiceConfigTest.loadServiceConfig());

  @Test
  void returnsClientConfigForMatch() {
    assertTrue(new RequestHandlerClientConfigRegistry(config).get("cloudwatch").isPresent());
    assertTrue(new RequestHandlerClientConfigRegistry(config).get("cloudwatch-eu").isPresent());
    assertFalse(new RequestHandlerClientConfigRegistry(config).get("non-existent").isPresent());
  }
}
