/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

/** Tag keys added by {@link CqlParser}. These are stable; do not derive them from span names. */
public final class CqlTraceKeys {
  /** The address of the node the event happened against. Ex. "127.0.0.1" */
  public static final String HOST = "cassandra.host";

  /** The native transport port of the node, in decimal. Ex. "9042" */
  public static final String PORT = "cassandra.port";

  /** The Cassandra release version of the node. Ex. "4.1.3" */
  public static final String VERSION = "cassandra.version";

  /** One of "UP", "DOWN" or "UNKNOWN". */
  public static final String HOST_STATE = "cassandra.host.state";

  /** The node's host ID. Only added when the driver knows it. */
  public static final String HOST_ID = "cassandra.host.id";

  public static final String KEYSPACE = "cassandra.keyspace";

  /**
   * The CQL of a query span. Ex. "insert into test_table (id, title) values (?, ?)"
   *
   * <p>Bound values are never included.
   */
  public static final String STATEMENT = "cassandra.stmt";

  /**
   * The statements of a batch span, in the order they were added, joined with {@link
   * #BATCH_STATEMENT_SEPARATOR}.
   *
   * <p>Statements are not escaped, so splitting this value only recovers the list when no
   * statement contains the separator itself, for example in a string literal. Use {@link
   * #BATCH_SIZE} for the statement count.
   */
  public static final String BATCH_STATEMENTS = "cassandra.batch.stmts";

  /** The number of statements in a batch span. */
  public static final String BATCH_SIZE = "cassandra.batch.size";

  /** Rows in the first page of a query result. */
  public static final String ROWS_RETURNED = "cassandra.rows.returned";

  /** Zero-based attempt number. Only added on retries. */
  public static final String ATTEMPTS = "cassandra.attempts";

  /** Separates statements in {@link #BATCH_STATEMENTS}, as they would be in a CQL batch. */
  public static final String BATCH_STATEMENT_SEPARATOR = "; ";

  CqlTraceKeys() {
  }
}
