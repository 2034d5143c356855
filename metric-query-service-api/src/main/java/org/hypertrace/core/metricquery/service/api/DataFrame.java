package org.hypertrace.core.metricquery.service.api;

import java.util.List;
import java.util.SortedMap;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A named, tagged time series: millisecond timestamps with a parallel column of nullable values.
 */
@Value
@Builder
public class DataFrame {
  String name;
  @Singular SortedMap<String, String> tags;
  @Singular List<Long> timestamps;
  @Singular List<Double> values;

  public int size() {
    return timestamps.size();
  }
}
