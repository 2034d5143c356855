package org.hypertrace.core.metricquery.service.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A {@code GetMetricData} request body as built by the caller. The service only ever changes the
 * {@code NextToken} while it walks through the result pages.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GetMetricDataInput {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("StartTime")
  @JsonSerialize(using = EpochSeconds.Serializer.class)
  Instant startTime;

  @JsonProperty("EndTime")
  @JsonSerialize(using = EpochSeconds.Serializer.class)
  Instant endTime;

  @JsonProperty("MetricDataQueries")
  @Singular
  List<MetricDataQuery> metricDataQueries;

  @JsonProperty("NextToken")
  String nextToken;

  @JsonProperty("ScanBy")
  String scanBy;

  @JsonProperty("MaxDatapoints")
  Integer maxDatapoints;

  public GetMetricDataInput withNextToken(String nextToken) {
    return toBuilder().nextToken(nextToken).build();
  }

  public String toJson() throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(this);
  }

  @Value
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class MetricDataQuery {
    @JsonProperty("Id")
    String id;

    @JsonProperty("Label")
    String label;

    @JsonProperty("Expression")
    String expression;

    @JsonProperty("MetricStat")
    MetricStat metricStat;

    @JsonProperty("Period")
    Integer period;

    @JsonProperty("ReturnData")
    Boolean returnData;
  }

  @Value
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class MetricStat {
    @JsonProperty("Metric")
    Metric metric;

    @JsonProperty("Period")
    int period;

    @JsonProperty("Stat")
    String stat;
  }

  @Value
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class Metric {
    @JsonProperty("Namespace")
    String namespace;

    @JsonProperty("MetricName")
    String metricName;

    @JsonProperty("Dimensions")
    @Singular
    List<Dimension> dimensions;
  }

  @Value
  @Builder
  public static class Dimension {
    @JsonProperty("Name")
    String name;

    @JsonProperty("Value")
    String value;
  }
}
