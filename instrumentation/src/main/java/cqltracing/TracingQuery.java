/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.internal.Nullable;
import brave.propagation.TraceContext;
import cqltracing.driver.DriverException;
import cqltracing.driver.Iter;
import cqltracing.driver.Query;

/**
 * A query whose spans are parented explicitly at execution time. Not safe for concurrent use, as
 * the underlying driver query is not.
 */
public final class TracingQuery {
  final TracingSession session;
  final Query delegate;

  TracingQuery(TracingSession session, Query delegate) {
    this.session = session;
    this.delegate = delegate;
  }

  /**
   * Executes as a child of the current trace context, if any.
   *
   * @throws DriverException unchanged from the driver
   */
  public void exec() {
    exec(session.currentContext());
  }

  /**
   * Executes, recording the query span as a child of {@code parent}.
   *
   * @param parent the parent of the query span, or null for a new trace.
   * @throws DriverException unchanged from the driver
   */
  public void exec(@Nullable TraceContext parent) {
    delegate.withContext(parent).exec();
  }

  /** Like {@link #exec()}, except returns the rows. */
  public Iter iter() {
    return iter(session.currentContext());
  }

  /** Like {@link #exec(TraceContext)}, except returns the rows. */
  public Iter iter(@Nullable TraceContext parent) {
    return delegate.withContext(parent).iter();
  }

  public Query unwrap() {
    return delegate;
  }

  @Override public String toString() {
    return "TracingQuery{" + delegate + "}";
  }
}
