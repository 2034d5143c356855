package org.hypertrace.core.metricquery.service.cloudwatch;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.metricquery.service.api.MetricQuery;

/**
 * Computes the display name of a series. An alias template may reference {@code {{region}}},
 * {@code {{namespace}}}, {@code {{metric}}}, {@code {{stat}}}, {@code {{period}}}, {@code
 * {{label}}} and any dimension name; unknown placeholders are left as they are.
 */
final class AliasFormatter {

  private static final Pattern ALIAS_PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.+?)\\s*\\}\\}");

  private AliasFormatter() {}

  static String format(MetricQuery query, String stat, Map<String, String> tags, String label) {
    String period = String.valueOf(query.getPeriod());

    // SEARCH('{AWS/EC2} cpu', 'Average', 300) ends with its stat and period
    if (query.isUserDefinedSearchExpression()) {
      String expression = query.getExpression();
      int periodIndex = expression.lastIndexOf(',');
      if (periodIndex >= 0) {
        period = StringUtils.strip(expression.substring(periodIndex + 1), " )");
        int statIndex = expression.lastIndexOf(',', periodIndex - 1);
        stat = StringUtils.strip(expression.substring(statIndex + 1, periodIndex), " '");
      }
    }

    String alias = query.getAlias();
    if (alias.isEmpty() && query.isMathExpression()) {
      return query.getId();
    }
    if (alias.isEmpty()
        && query.isInferredSearchExpression()
        && !query.isMultiValuedDimensionExpression()) {
      return label;
    }

    Map<String, String> context = new HashMap<>();
    context.put("region", query.getRegion());
    context.put("namespace", query.getNamespace());
    context.put("metric", query.getMetricName());
    context.put("stat", stat);
    context.put("period", period);
    if (!label.isEmpty()) {
      context.put("label", label);
    }
    context.putAll(tags);

    String name = evaluate(alias, context);
    if (name.isEmpty()) {
      return query.getMetricName() + "_" + stat;
    }
    return name;
  }

  static String evaluate(String template, Map<String, String> context) {
    Matcher matcher = ALIAS_PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String replacement = context.getOrDefault(matcher.group(1).trim(), matcher.group());
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
