/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import cqltracing.driver.Batch;
import cqltracing.driver.BatchType;

/**
 * Statements to run together via {@link TracingSession#executeBatch(TracingBatch,
 * brave.propagation.TraceContext)}. The batch is recorded as one span listing every statement.
 */
public final class TracingBatch {
  final Batch delegate;

  TracingBatch(Batch delegate) {
    this.delegate = delegate;
  }

  /** Adds a statement. Statements execute, and are tagged, in the order added. */
  public TracingBatch query(String statement, Object... values) {
    delegate.query(statement, values);
    return this;
  }

  public BatchType type() {
    return delegate.type();
  }

  public int size() {
    return delegate.size();
  }

  public Batch unwrap() {
    return delegate;
  }

  @Override public String toString() {
    return "TracingBatch{" + delegate + "}";
  }
}
