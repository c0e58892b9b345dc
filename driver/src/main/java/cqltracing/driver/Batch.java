/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** Statements sent together in one request. Not safe for concurrent use. */
public interface Batch {
  BatchType type();

  /** Like {@link Query#withContext(Object)}, but reported on {@link ObservedBatch#context()}. */
  Batch withContext(Object context);

  /** Adds a statement. Statements execute in the order added. */
  void query(String statement, Object... values);

  int size();
}
