package org.hypertrace.core.metricquery.service.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MetricQueryTest {

  private static MetricQuery.MetricQueryBuilder query() {
    return MetricQuery.builder().id("a").period(60).namespace("AWS/EC2").metricName("cpu");
  }

  @Test
  void testMetricStatQuery() {
    MetricQuery query = query().dimension("InstanceId", List.of("i-01")).build();

    assertEquals(QueryKind.METRIC_STAT, query.getKind());
    assertFalse(query.isMathExpression());
    assertFalse(query.isInferredSearchExpression());
    assertFalse(query.isMultiValuedDimensionExpression());
  }

  @Test
  void testNullStringsAreNormalizedAndFlagsDefaultToTrue() {
    MetricQuery query = MetricQuery.builder().id("a").period(300).build();

    assertEquals("", query.getRefId());
    assertEquals("", query.getAlias());
    assertEquals("", query.getExpression());
    assertTrue(query.isMatchExact());
    assertTrue(query.isReturnData());
    assertTrue(query.getDimensions().isEmpty());
  }

  @Test
  void testExpressionKinds() {
    assertEquals(QueryKind.MATH_EXPRESSION, query().expression("m1 * 100").build().getKind());
    assertEquals(
        QueryKind.USER_DEFINED_SEARCH,
        query().expression("SUM(SEARCH('{AWS/EC2} cpu', 'Average', 60))").build().getKind());
  }

  @Test
  void testExpressionWinsOverSearchDimensions() {
    MetricQuery query =
        query().expression("m1 + m2").dimension("InstanceId", List.of("*")).build();

    assertTrue(query.isMathExpression());
    assertFalse(query.isInferredSearchExpression());
  }

  @Test
  void testInferredSearchKinds() {
    assertTrue(
        query().dimension("InstanceId", List.of("*")).build().isInferredSearchExpression());
    assertTrue(
        query()
            .dimension("InstanceId", List.of("i-01", "i-02"))
            .build()
            .isInferredSearchExpression());
    assertTrue(query().matchExact(false).build().isInferredSearchExpression());
  }

  @Test
  void testMultiValuedDimensionFollowsDimensionNameOrder() {
    MetricQuery wildcardFirst =
        query()
            .dimension("B", List.of("b1", "b2"))
            .dimension("A", List.of("*"))
            .build();
    assertFalse(wildcardFirst.isMultiValuedDimensionExpression());

    MetricQuery fanOutFirst =
        query()
            .dimension("B", List.of("*"))
            .dimension("A", List.of("a1", "a2"))
            .build();
    assertTrue(fanOutFirst.isMultiValuedDimensionExpression());
    assertEquals(List.of("A", "B"), List.copyOf(fanOutFirst.getDimensions().keySet()));
  }

  @Test
  void testInvalidQueriesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> query().id("").build());
    assertThrows(IllegalArgumentException.class, () -> query().period(0).build());
  }

  @Test
  void testDimensionsAreImmutable() {
    MetricQuery query = query().dimension("InstanceId", List.of("i-01")).build();

    assertThrows(
        UnsupportedOperationException.class,
        () -> query.getDimensions().get("InstanceId").add("i-02"));
  }
}
