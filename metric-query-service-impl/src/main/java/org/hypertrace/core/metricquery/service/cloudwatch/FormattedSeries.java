package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.List;
import lombok.Value;
import org.hypertrace.core.metricquery.service.api.DataFrame;

@Value
class FormattedSeries {
  List<DataFrame> frames;
  boolean partialData;
}
