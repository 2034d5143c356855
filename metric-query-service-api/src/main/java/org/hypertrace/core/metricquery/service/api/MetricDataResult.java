package org.hypertrace.core.metricquery.service.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One fragment of a query result: the data points returned for a single (id, label) pair in one
 * result page. {@code values} runs parallel to {@code timestamps} and may hold {@code null}s.
 */
@Value
public class MetricDataResult {
  public static final String STATUS_COMPLETE = "Complete";
  public static final String STATUS_PARTIAL_DATA = "PartialData";

  String id;
  String label;
  List<Instant> timestamps;
  List<Double> values;
  String statusCode;
  List<MessageData> messages;

  @JsonCreator
  @Builder(toBuilder = true)
  private MetricDataResult(
      @JsonProperty("Id") String id,
      @JsonProperty("Label") String label,
      @JsonProperty("Timestamps") @JsonDeserialize(contentUsing = EpochSeconds.Deserializer.class)
          @Singular
          List<Instant> timestamps,
      @JsonProperty("Values") @Singular List<Double> values,
      @JsonProperty("StatusCode") String statusCode,
      @JsonProperty("Messages") @Singular List<MessageData> messages) {
    this.id = id;
    this.label = label == null ? "" : label;
    this.timestamps = copyOf(timestamps);
    this.values = copyOf(values);
    this.statusCode = statusCode;
    this.messages = copyOf(messages);
    if (this.timestamps.size() != this.values.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Result %s/%s has %d timestamps but %d values",
              id, this.label, this.timestamps.size(), this.values.size()));
    }
  }

  @JsonIgnore
  public boolean isComplete() {
    return STATUS_COMPLETE.equals(statusCode);
  }

  @JsonIgnore
  public boolean hasMessage(String code) {
    return messages.stream().anyMatch(message -> message.hasCode(code));
  }

  // values may contain nulls, so List.copyOf is not an option
  private static <T> List<T> copyOf(List<T> list) {
    return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
  }
}
