package org.hypertrace.core.metricquery.service.cloudwatch;

import static org.hypertrace.core.metricquery.service.cloudwatch.CloudWatchTestUtils.cpuQuery;
import static org.hypertrace.core.metricquery.service.cloudwatch.CloudWatchTestUtils.readResource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.hypertrace.core.metricquery.service.QueryCost;
import org.hypertrace.core.metricquery.service.api.GetMetricDataInput;
import org.hypertrace.core.metricquery.service.api.GetMetricDataInput.MetricDataQuery;
import org.hypertrace.core.metricquery.service.api.MetricQueryRequest;
import org.hypertrace.core.metricquery.service.api.MetricQueryResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CloudWatchBasedRequestHandlerTest {

  private MockWebServer mockWebServer;
  private CloudWatchRestClient cloudWatchRestClient;
  private MeterRegistry meterRegistry;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    cloudWatchRestClient =
        new CloudWatchRestClient(
            mockWebServer.getHostName() + ":" + mockWebServer.getPort(), new OkHttpClient());
    meterRegistry = new SimpleMeterRegistry();
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  public void testInit() {
    Assertions.assertDoesNotThrow(
        () -> newHandler(Map.of("region", "us-east-1", "cost", 0.3)));
  }

  @Test
  public void testInitFailsWithoutRegion() {
    Assertions.assertThrows(RuntimeException.class, () -> newHandler(Map.of("cost", 0.3)));
  }

  @Test
  public void testCanHandleOwnRegionOnly() {
    CloudWatchBasedRequestHandler handler =
        newHandler(Map.of("region", "us-east-1", "cost", 0.3));

    QueryCost ownRegion = handler.canHandle(request("us-east-1"));
    Assertions.assertTrue(ownRegion.isSupported());
    Assertions.assertEquals(0.3, ownRegion.getCost());

    Assertions.assertFalse(handler.canHandle(request("eu-west-1")).isSupported());
  }

  @Test
  public void testWildcardRegionUsesDefaultCost() {
    CloudWatchBasedRequestHandler handler = newHandler(Map.of("region", "*"));

    QueryCost cost = handler.canHandle(request("ap-south-1"));
    Assertions.assertTrue(cost.isSupported());
    Assertions.assertEquals(0.5, cost.getCost());
  }

  @Test
  public void testHandleRequest() throws IOException {
    mockWebServer.enqueue(getSuccessMockResponse("cloudwatch_metric_data_page_1.json"));
    mockWebServer.enqueue(getSuccessMockResponse("cloudwatch_metric_data_page_2.json"));
    CloudWatchBasedRequestHandler handler = newHandler(Map.of("region", "us-east-1"));

    List<MetricQueryResponse> responses =
        handler.handleRequest(request("us-east-1")).toList().blockingGet();

    Assertions.assertEquals(2, responses.size());
    Assertions.assertEquals("a", responses.get(0).getId());
    Assertions.assertEquals(2, responses.get(0).getFrames().size());
    Assertions.assertEquals("b", responses.get(1).getFrames().get(0).getName());
    Assertions.assertEquals(2.0, responseCount("exceeded_limit"));
    Assertions.assertEquals(0.0, responseCount("partial_data"));
    Assertions.assertEquals(0.0, responseCount("error"));
  }

  @Test
  public void testQueryErrorIsCounted() throws IOException {
    mockWebServer.enqueue(getSuccessMockResponse("cloudwatch_metric_data_arithmetic_error.json"));
    CloudWatchBasedRequestHandler handler = newHandler(Map.of("region", "us-east-1"));
    MetricQueryRequest request =
        MetricQueryRequest.builder()
            .region("us-east-1")
            .query(cpuQuery("c").expression("m1 / m2").build())
            .query(cpuQuery("d").build())
            .input(input("c"))
            .build();

    List<MetricQueryResponse> responses = handler.handleRequest(request).toList().blockingGet();

    Assertions.assertTrue(responses.get(0).getError().isPresent());
    Assertions.assertTrue(responses.get(1).getError().isEmpty());
    Assertions.assertEquals(1.0, responseCount("error"));
  }

  @Test
  public void testClientFailureIsPropagated() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    CloudWatchBasedRequestHandler handler = newHandler(Map.of("region", "us-east-1"));

    Assertions.assertThrows(
        CloudWatchClientException.class,
        () -> handler.handleRequest(request("us-east-1")).toList().blockingGet());
  }

  @Test
  public void testRequestWithoutInputsIsRejected() {
    CloudWatchBasedRequestHandler handler = newHandler(Map.of("region", "us-east-1"));
    MetricQueryRequest request =
        MetricQueryRequest.builder().region("us-east-1").query(cpuQuery("a").build()).build();

    Assertions.assertThrows(IllegalArgumentException.class, () -> handler.handleRequest(request));
  }

  private CloudWatchBasedRequestHandler newHandler(Map<String, ?> requestHandlerInfo) {
    Config config = ConfigFactory.parseMap(requestHandlerInfo);
    return new CloudWatchBasedRequestHandler(
        "cloudwatch-test", config, cloudWatchRestClient, meterRegistry);
  }

  private double responseCount(String outcome) {
    return meterRegistry
        .get("hypertrace.metric.query.cloudwatch.responses")
        .tag("handler", "cloudwatch-test")
        .tag("outcome", outcome)
        .counter()
        .count();
  }

  private static MetricQueryRequest request(String region) {
    return MetricQueryRequest.builder()
        .region(region)
        .query(
            cpuQuery("a")
                .dimension("InstanceId", List.of("i-01", "i-02"))
                .alias("{{InstanceId}}")
                .build())
        .query(cpuQuery("b").expression("a * 2").build())
        .input(input("a"))
        .build();
  }

  private static GetMetricDataInput input(String queryId) {
    return GetMetricDataInput.builder()
        .startTime(Instant.ofEpochSecond(1600000000L))
        .endTime(Instant.ofEpochSecond(1600000300L))
        .metricDataQuery(MetricDataQuery.builder().id(queryId).expression("SUM(m1)").build())
        .build();
  }

  private static MockResponse getSuccessMockResponse(String fileName) throws IOException {
    return new MockResponse()
        .setResponseCode(200)
        .addHeader("Content-Type", "application/x-amz-json-1.0")
        .setBody(readResource(fileName));
  }
}
