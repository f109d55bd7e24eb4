package com.scylladb.admin.explain;

import com.scylladb.admin.errors.ExplainException;
import java.util.List;

/**
 * A query planner simulator that explains how statements would be routed, given the routing
 * metadata of a keyspace.
 *
 * <p>Implementations are stateful: {@link #init} loads the metadata that later {@link #run} calls
 * plan against. An instance is used for a single request and is not shared between threads.
 *
 * <p>The command line tool finds its engine with {@link java.util.ServiceLoader}, so
 * implementations may register themselves in {@code META-INF/services}.
 *
 * @since 1.0.0
 */
public interface ExplainEngine {
  /**
   * Loads the routing metadata.
   *
   * @param input the serialized vschema, schema and shard map
   * @param options planner options
   * @throws ExplainException if the metadata cannot be loaded
   */
  void init(ExplainInput input, ExplainOptions options) throws ExplainException;

  /**
   * Plans the given SQL, which may hold several statements.
   *
   * @param sql the SQL text
   * @return one plan per statement
   * @throws ExplainException if the SQL cannot be planned
   */
  List<ExplainPlan> run(String sql) throws ExplainException;

  /**
   * Renders plans as human readable text.
   *
   * @param plans plans returned by {@link #run}
   * @return the rendered text
   */
  String render(List<ExplainPlan> plans);
}
