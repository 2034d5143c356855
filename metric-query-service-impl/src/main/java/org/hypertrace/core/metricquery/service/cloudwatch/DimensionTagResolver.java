package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.hypertrace.core.metricquery.service.api.MetricQuery;

/** Rebuilds the dimension tags of a series from the query's candidate dimension values. */
final class DimensionTagResolver {

  static final String WILDCARD = "*";

  private DimensionTagResolver() {}

  /**
   * Dimensions with a single concrete value are tagged with it. For any other dimension the label
   * picks the tag: a candidate equal to the label (or a wildcard) tags the label itself, otherwise
   * a candidate contained in the label tags that candidate. When several candidates are contained
   * in the label the last one wins.
   */
  static SortedMap<String, String> resolveTags(MetricQuery query, String label) {
    SortedMap<String, String> tags = new TreeMap<>();
    for (Map.Entry<String, List<String>> dimension : query.getDimensions().entrySet()) {
      String name = dimension.getKey();
      List<String> values = dimension.getValue();
      if (values.size() == 1 && !WILDCARD.equals(values.get(0))) {
        tags.put(name, values.get(0));
        continue;
      }
      for (String value : values) {
        if (value.equals(label) || WILDCARD.equals(value)) {
          tags.put(name, label);
        } else if (label.contains(value)) {
          tags.put(name, value);
        }
      }
    }
    return tags;
  }

  /**
   * One tag set per candidate of the dimension with the most candidates. Other dimensions are only
   * tagged when they have exactly one candidate.
   */
  static List<SortedMap<String, String>> fanOutTags(MetricQuery query) {
    List<SortedMap<String, String>> tagSets = new ArrayList<>();
    Optional<String> dominant = dominantDimension(query);
    if (dominant.isEmpty()) {
      return tagSets;
    }
    String dominantName = dominant.get();
    for (String value : query.getDimensions().get(dominantName)) {
      SortedMap<String, String> tags = new TreeMap<>();
      tags.put(dominantName, value);
      query.getDimensions().forEach(
          (name, values) -> {
            if (!name.equals(dominantName) && values.size() == 1) {
              tags.put(name, values.get(0));
            }
          });
      tagSets.add(tags);
    }
    return tagSets;
  }

  /** The first dimension, in name order, with strictly more candidates than any before it. */
  static Optional<String> dominantDimension(MetricQuery query) {
    String dominant = null;
    int mostCandidates = 0;
    for (Map.Entry<String, List<String>> dimension : query.getDimensions().entrySet()) {
      if (dimension.getValue().size() > mostCandidates) {
        mostCandidates = dimension.getValue().size();
        dominant = dimension.getKey();
      }
    }
    return Optional.ofNullable(dominant);
  }
}
