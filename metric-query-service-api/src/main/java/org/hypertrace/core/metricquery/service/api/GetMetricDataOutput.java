package org.hypertrace.core.metricquery.service.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** One page of a {@code GetMetricData} response. */
@Value
public class GetMetricDataOutput {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  List<MetricDataResult> metricDataResults;
  String nextToken;
  List<MessageData> messages;

  @JsonCreator
  @Builder
  private GetMetricDataOutput(
      @JsonProperty("MetricDataResults") @Singular List<MetricDataResult> metricDataResults,
      @JsonProperty("NextToken") String nextToken,
      @JsonProperty("Messages") @Singular List<MessageData> messages) {
    this.metricDataResults = metricDataResults == null ? List.of() : List.copyOf(metricDataResults);
    this.nextToken = nextToken;
    this.messages = messages == null ? List.of() : List.copyOf(messages);
  }

  @JsonIgnore
  public Optional<String> getNextTokenIfPresent() {
    return Optional.ofNullable(nextToken).filter(token -> !token.isEmpty());
  }

  @JsonIgnore
  public boolean hasMessage(String code) {
    return messages.stream().anyMatch(message -> message.hasCode(code));
  }

  public static GetMetricDataOutput fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, GetMetricDataOutput.class);
  }
}
