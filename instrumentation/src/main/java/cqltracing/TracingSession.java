/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Tracing;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import cqltracing.driver.BatchType;
import cqltracing.driver.ClusterConfig;
import cqltracing.driver.DriverException;
import cqltracing.driver.Session;
import java.io.Closeable;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Session} whose cluster reports connect, query and batch events to {@link CqlTracing}.
 *
 * <p>Queries and batches run as children of the trace context passed to them, or of {@link
 * brave.propagation.CurrentTraceContext#get() the current one} when none is passed. The driver
 * reports events from its own threads, so the parent is attached to the query rather than read
 * from a thread local at the time of the event.
 *
 * <p>Ex.
 * <pre>{@code
 * TracingSession session = TracingSession.create(cluster, b -> b.tracing(tracing));
 * ScopedSpan parent = tracing.tracer().startScopedSpan("save-books");
 * try {
 *   session.query("insert into book (id, title) values (?, ?)", id, title).exec(parent.context());
 * } finally {
 *   parent.finish();
 * }
 * }</pre>
 */
public final class TracingSession implements Closeable {
  static final Logger LOG = Logger.getLogger(CqlTracing.INSTRUMENTATION_NAME);

  /**
   * Builds {@link CqlTracing} from the options, installs it on the cluster and creates a session.
   *
   * @throws DriverException unchanged from {@link ClusterConfig#createSession()}
   */
  public static TracingSession create(ClusterConfig cluster, CqlTracingCustomizer... options) {
    return create(cluster, CqlTracing.create(options));
  }

  /**
   * Installs an observer per event kind on the cluster, then creates a session from it.
   *
   * <p>An observer already assigned to a slot is kept, and called before those added via {@link
   * CqlTracing.Builder}. Installing again replaces the earlier instrumentation and keeps the
   * observers it called. A slot is left alone when its kind is disabled and no observers were added
   * for it.
   *
   * @throws DriverException unchanged from {@link ClusterConfig#createSession()}
   */
  public static TracingSession create(ClusterConfig cluster, CqlTracing cqlTracing) {
    if (cluster == null) throw new NullPointerException("cluster == null");
    if (cqlTracing == null) throw new NullPointerException("cqlTracing == null");
    install(cluster, cqlTracing);
    return new TracingSession(cqlTracing, cluster.createSession());
  }

  static void install(ClusterConfig cluster, CqlTracing cqlTracing) {
    CqlTracing.Builder builder = cqlTracing.toBuilder();
    boolean replaceConnect = prepend(builder.connectObservers, cluster.connectObserver(),
      TracingConnectObserver.class);
    boolean replaceQuery = prepend(builder.queryObservers, cluster.queryObserver(),
      TracingQueryObserver.class);
    boolean replaceBatch = prepend(builder.batchObservers, cluster.batchObserver(),
      TracingBatchObserver.class);
    CqlTracing composed = builder.build();

    if (replaceConnect
      || needsObserver(cqlTracing.connectInstrumentation, cqlTracing.connectObservers)) {
      cluster.connectObserver(composed.connectObserver());
    }
    if (replaceQuery
      || needsObserver(cqlTracing.queryInstrumentation, cqlTracing.queryObservers)) {
      cluster.queryObserver(composed.queryObserver());
    }
    if (replaceBatch
      || needsObserver(cqlTracing.batchInstrumentation, cqlTracing.batchObservers)) {
      cluster.batchObserver(composed.batchObserver());
    }
  }

  static boolean needsObserver(boolean enabled, List<?> observers) {
    return enabled || !observers.isEmpty();
  }

  /**
   * Keeps an observer the cluster already had by calling it first. Returns true when the existing
   * observer is one of ours from an earlier install. That one is replaced, but the observers it
   * called are kept ahead of the configured ones, skipping any already configured.
   */
  static <O> boolean prepend(List<O> observers, @Nullable O existing, Class<?> ours) {
    if (existing == null) return false;
    if (!ours.isInstance(existing)) {
      observers.add(0, existing);
      return false;
    }

    LOG.log(Level.FINE, "replacing {0} installed by an earlier session", existing);
    @SuppressWarnings("unchecked")
    List<O> earlier = ((CqlObserverHandler<?, O>) existing).observers;
    int i = 0;
    for (O observer : earlier) {
      if (!containsInstance(observers, observer)) observers.add(i++, observer);
    }
    return true;
  }

  static boolean containsInstance(List<?> list, Object element) {
    for (Object next : list) {
      if (next == element) return true;
    }
    return false;
  }

  final CqlTracing cqlTracing;
  final Session delegate;

  TracingSession(CqlTracing cqlTracing, Session delegate) {
    this.cqlTracing = cqlTracing;
    this.delegate = delegate;
  }

  /** Creates a query of the statement bound to positional values. */
  public TracingQuery query(String statement, Object... values) {
    return new TracingQuery(this, delegate.query(statement, values));
  }

  public TracingBatch newBatch(BatchType type) {
    return new TracingBatch(delegate.newBatch(type));
  }

  /**
   * Executes the batch as a child of the current trace context, if any.
   *
   * @throws DriverException unchanged from the driver
   */
  public void executeBatch(TracingBatch batch) {
    executeBatch(batch, currentContext());
  }

  /**
   * Executes the batch, recording its span as a child of {@code parent}.
   *
   * @param parent the parent of the batch span, or null for a new trace.
   * @throws DriverException unchanged from the driver
   */
  public void executeBatch(TracingBatch batch, @Nullable TraceContext parent) {
    if (batch == null) throw new NullPointerException("batch == null");
    delegate.executeBatch(batch.delegate.withContext(parent));
  }

  public CqlTracing cqlTracing() {
    return cqlTracing;
  }

  /** Returns the driver session, for operations this type does not expose. */
  public Session unwrap() {
    return delegate;
  }

  public boolean isClosed() {
    return delegate.isClosed();
  }

  @Override public void close() {
    delegate.close();
  }

  @Nullable TraceContext currentContext() {
    Tracing tracing = cqlTracing.tracing != null ? cqlTracing.tracing : Tracing.current();
    return tracing != null ? tracing.currentTraceContext().get() : null;
  }

  @Override public String toString() {
    return "TracingSession{" + delegate + "}";
  }
}
