package org.hypertrace.core.metricquery.service;

public class QueryCost {

  public static final QueryCost UNSUPPORTED = new QueryCost(-1);

  private final double cost;

  public QueryCost(double cost) {
    this.cost = cost;
  }

  /**
   * Return the cost to evaluate the request.
   *
   * @return -1 means it cannot handle the request else 0 (super fast) to 1 very expensive
   */
  public double getCost() {
    return cost;
  }

  public boolean isSupported() {
    return cost >= 0;
  }
}
