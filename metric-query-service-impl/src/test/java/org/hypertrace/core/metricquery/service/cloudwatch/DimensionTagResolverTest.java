package org.hypertrace.core.metricquery.service.cloudwatch;

import static org.hypertrace.core.metricquery.service.cloudwatch.CloudWatchTestUtils.cpuQuery;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.metricquery.service.api.MetricQuery;
import org.junit.jupiter.api.Test;

class DimensionTagResolverTest {

  @Test
  void testSingleConcreteValueIsAlwaysTagged() {
    MetricQuery query = cpuQuery("a").dimension("InstanceId", List.of("i-01")).build();

    assertEquals(
        Map.of("InstanceId", "i-01"), DimensionTagResolver.resolveTags(query, "unrelated"));
  }

  @Test
  void testWildcardTagsTheLabel() {
    MetricQuery query = cpuQuery("a").dimension("InstanceId", List.of("*")).build();

    assertEquals(Map.of("InstanceId", "i-05"), DimensionTagResolver.resolveTags(query, "i-05"));
  }

  @Test
  void testExactAndContainedCandidates() {
    MetricQuery query =
        cpuQuery("a")
            .dimension("InstanceId", List.of("i-01", "i-02"))
            .dimension("InstanceType", List.of("t2.micro", "m5.large"))
            .build();

    assertEquals(
        Map.of("InstanceId", "i-02"), DimensionTagResolver.resolveTags(query, "i-02"));
    assertEquals(
        Map.of("InstanceId", "i-01", "InstanceType", "m5.large"),
        DimensionTagResolver.resolveTags(query, "i-01 m5.large"));
  }

  @Test
  void testLastContainedCandidateWins() {
    MetricQuery query = cpuQuery("a").dimension("Queue", List.of("orders", "orders-dlq")).build();

    assertEquals(
        Map.of("Queue", "orders-dlq"), DimensionTagResolver.resolveTags(query, "orders-dlq sum"));
  }

  @Test
  void testUnmatchedLabelLeavesDimensionUntagged() {
    MetricQuery query = cpuQuery("a").dimension("InstanceId", List.of("i-01", "i-02")).build();

    assertTrue(DimensionTagResolver.resolveTags(query, "other").isEmpty());
  }

  @Test
  void testDominantDimensionTiesResolveByName() {
    MetricQuery query =
        cpuQuery("a")
            .dimension("zone", List.of("a", "b"))
            .dimension("host", List.of("h1", "h2"))
            .dimension("az", List.of("x"))
            .build();

    assertEquals(Optional.of("host"), DimensionTagResolver.dominantDimension(query));
  }

  @Test
  void testFanOutTagsUseTheWidestDimension() {
    MetricQuery query =
        cpuQuery("a")
            .dimension("host", List.of("h1", "h2"))
            .dimension("zone", List.of("a", "b", "c"))
            .dimension("env", List.of("prod"))
            .build();

    assertEquals(
        List.of(
            Map.of("zone", "a", "env", "prod"),
            Map.of("zone", "b", "env", "prod"),
            Map.of("zone", "c", "env", "prod")),
        DimensionTagResolver.fanOutTags(query));
  }

  @Test
  void testNoDimensionsNoFanOut() {
    assertTrue(DimensionTagResolver.fanOutTags(cpuQuery("a").build()).isEmpty());
  }
}
