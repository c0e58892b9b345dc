/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Tracer;
import brave.Tracing;
import brave.internal.Nullable;
import cqltracing.driver.BatchObserver;
import cqltracing.driver.ClusterConfig;
import cqltracing.driver.ConnectObserver;
import cqltracing.driver.QueryObserver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configures tracing and metrics of CQL driver events. Instances are immutable and safe to share
 * between threads and sessions.
 *
 * <p>To trace a cluster, either create the session via {@link #newSession(ClusterConfig)}, or
 * assign {@link #connectObserver()}, {@link #queryObserver()} and {@link #batchObserver()} to the
 * cluster yourself.
 *
 * <p>Unless {@link Builder#tracing(Tracing)} is set, spans go to {@link Tracing#current()},
 * looked up on each event. Until a {@link Tracing} is current, no spans are recorded.
 */
public final class CqlTracing {
  /** The {@link java.util.logging.Logger} name this instrumentation logs to. */
  public static final String INSTRUMENTATION_NAME = "cqltracing";

  /** Like {@link #newBuilder(Tracing)}, but with all defaults. */
  public static CqlTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  /** Returns a builder that uses the current {@link Tracing} component, if any. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(Tracing tracing) {
    if (tracing == null) throw new NullPointerException("tracing == null");
    return new Builder().tracing(tracing);
  }

  /** Applies each option in order to a new builder. */
  public static CqlTracing create(CqlTracingCustomizer... options) {
    Builder builder = newBuilder();
    for (CqlTracingCustomizer option : options) {
      if (option == null) throw new NullPointerException("option == null");
      option.customize(builder);
    }
    return builder.build();
  }

  /** An observer that records connect spans, then calls {@link Builder#addConnectObserver}s. */
  public ConnectObserver connectObserver() {
    return new TracingConnectObserver(this);
  }

  /** An observer that records query spans, then calls {@link Builder#addQueryObserver}s. */
  public QueryObserver queryObserver() {
    return new TracingQueryObserver(this);
  }

  /** An observer that records batch spans, then calls {@link Builder#addBatchObserver}s. */
  public BatchObserver batchObserver() {
    return new TracingBatchObserver(this);
  }

  /**
   * Installs this instrumentation on the cluster, then creates a session from it.
   *
   * @see TracingSession#create(ClusterConfig, CqlTracing)
   */
  public TracingSession newSession(ClusterConfig cluster) {
    return TracingSession.create(cluster, this);
  }

  /** The explicitly configured tracing component, or null to use the current one. */
  @Nullable public Tracing tracing() {
    return tracing;
  }

  public MeterRegistry meterRegistry() {
    return meterRegistry;
  }

  public CqlParser parser() {
    return parser;
  }

  public boolean isEnabled(CqlEventKind kind) {
    switch (kind) {
      case CONNECT:
        return connectInstrumentation;
      case QUERY:
        return queryInstrumentation;
      case BATCH:
        return batchInstrumentation;
      default:
        throw new AssertionError(kind);
    }
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Nullable Tracer tracer() {
    Tracing tracing = this.tracing != null ? this.tracing : Tracing.current();
    return tracing != null ? tracing.tracer() : null;
  }

  @Nullable final Tracing tracing;
  final MeterRegistry meterRegistry;
  final CqlMetrics metrics;
  final CqlParser parser;
  final boolean connectInstrumentation, queryInstrumentation, batchInstrumentation;
  final List<ConnectObserver> connectObservers;
  final List<QueryObserver> queryObservers;
  final List<BatchObserver> batchObservers;

  CqlTracing(Builder builder) {
    tracing = builder.tracing;
    meterRegistry = builder.meterRegistry;
    metrics = new CqlMetrics(meterRegistry);
    parser = builder.parser;
    connectInstrumentation = builder.connectInstrumentation;
    queryInstrumentation = builder.queryInstrumentation;
    batchInstrumentation = builder.batchInstrumentation;
    connectObservers = Collections.unmodifiableList(new ArrayList<>(builder.connectObservers));
    queryObservers = Collections.unmodifiableList(new ArrayList<>(builder.queryObservers));
    batchObservers = Collections.unmodifiableList(new ArrayList<>(builder.batchObservers));
  }

  @Override public String toString() {
    return "CqlTracing{tracing=" + (tracing != null ? tracing : "current")
      + ", connectInstrumentation=" + connectInstrumentation
      + ", queryInstrumentation=" + queryInstrumentation
      + ", batchInstrumentation=" + batchInstrumentation + "}";
  }

  public static final class Builder {
    Tracing tracing;
    MeterRegistry meterRegistry;
    CqlParser parser;
    boolean connectInstrumentation, queryInstrumentation, batchInstrumentation;
    final List<ConnectObserver> connectObservers = new ArrayList<>();
    final List<QueryObserver> queryObservers = new ArrayList<>();
    final List<BatchObserver> batchObservers = new ArrayList<>();

    Builder() {
      meterRegistry = new CompositeMeterRegistry(); // records nothing until a child is added
      parser = CqlParser.DEFAULT;
      connectInstrumentation = queryInstrumentation = batchInstrumentation = true;
    }

    Builder(CqlTracing source) {
      tracing = source.tracing;
      meterRegistry = source.meterRegistry;
      parser = source.parser;
      connectInstrumentation = source.connectInstrumentation;
      queryInstrumentation = source.queryInstrumentation;
      batchInstrumentation = source.batchInstrumentation;
      connectObservers.addAll(source.connectObservers);
      queryObservers.addAll(source.queryObservers);
      batchObservers.addAll(source.batchObservers);
    }

    /**
     * Sets the tracing component spans are recorded with. Null reverts to {@link
     * Tracing#current()}.
     */
    public Builder tracing(@Nullable Tracing tracing) {
      this.tracing = tracing;
      return this;
    }

    /** Sets where metrics are recorded. Null reverts to a registry that records nothing. */
    public Builder meterRegistry(@Nullable MeterRegistry meterRegistry) {
      this.meterRegistry = meterRegistry != null ? meterRegistry : new CompositeMeterRegistry();
      return this;
    }

    /** Overrides the span naming and tagging policy. */
    public Builder parser(CqlParser parser) {
      if (parser == null) throw new NullPointerException("parser == null");
      this.parser = parser;
      return this;
    }

    /**
     * Adds an observer called after the span of each connect event, in the order added. Called
     * even when connect instrumentation is disabled.
     */
    public Builder addConnectObserver(ConnectObserver connectObserver) {
      if (connectObserver == null) throw new NullPointerException("connectObserver == null");
      connectObservers.add(connectObserver);
      return this;
    }

    /** Like {@link #addConnectObserver(ConnectObserver)}, but for query events. */
    public Builder addQueryObserver(QueryObserver queryObserver) {
      if (queryObserver == null) throw new NullPointerException("queryObserver == null");
      queryObservers.add(queryObserver);
      return this;
    }

    /** Like {@link #addConnectObserver(ConnectObserver)}, but for batch events. */
    public Builder addBatchObserver(BatchObserver batchObserver) {
      if (batchObserver == null) throw new NullPointerException("batchObserver == null");
      batchObservers.add(batchObserver);
      return this;
    }

    /** When false, no spans or metrics are recorded for connection attempts. Defaults to true. */
    public Builder connectInstrumentation(boolean connectInstrumentation) {
      this.connectInstrumentation = connectInstrumentation;
      return this;
    }

    /** When false, no spans or metrics are recorded for queries. Defaults to true. */
    public Builder queryInstrumentation(boolean queryInstrumentation) {
      this.queryInstrumentation = queryInstrumentation;
      return this;
    }

    /** When false, no spans or metrics are recorded for batches. Defaults to true. */
    public Builder batchInstrumentation(boolean batchInstrumentation) {
      this.batchInstrumentation = batchInstrumentation;
      return this;
    }

    public CqlTracing build() {
      return new CqlTracing(this);
    }
  }
}
