/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** A statement bound to positional values, ready to execute. Not safe for concurrent use. */
public interface Query {
  /**
   * Attaches a caller value that the driver hands back, unmodified, on each {@link ObservedQuery}
   * this query produces.
   */
  Query withContext(Object context);

  /** Executes the query, discarding any rows. */
  void exec();

  /** Executes the query, returning an iterator over its rows. */
  Iter iter();
}
