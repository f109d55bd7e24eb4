package com.scylladb.admin.explain;

/** The plan an {@link ExplainEngine} produced for one statement. */
public final class ExplainPlan {
  private final String sql;
  private final String plan;

  public ExplainPlan(String sql, String plan) {
    this.sql = sql;
    this.plan = plan;
  }

  /** Returns the statement the plan belongs to. */
  public String getSql() {
    return sql;
  }

  /** Returns the engine's textual rendering of the plan. */
  public String getPlan() {
    return plan;
  }

  @Override
  public String toString() {
    return "ExplainPlan{sql='" + sql + "'}";
  }
}
