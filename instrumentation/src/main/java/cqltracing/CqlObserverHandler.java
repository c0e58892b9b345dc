/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Span;
import brave.Tracer;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import cqltracing.driver.HostInfo;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static brave.Span.Kind.CLIENT;
import static brave.internal.Throwables.propagateIfFatal;

/**
 * Turns one kind of driver event into a span and metrics, then forwards it to the observers
 * registered for that kind.
 *
 * <p>The driver calls this after the outcome is known, so the span is started and finished within
 * the same call, using the timestamps of the event. Nothing here throws to the driver.
 *
 * @param <E> the event type
 * @param <O> the driver observer type for the same event
 */
abstract class CqlObserverHandler<E, O> {
  static final Logger LOG = Logger.getLogger(CqlTracing.INSTRUMENTATION_NAME);
  static final String REMOTE_SERVICE_NAME = "cassandra";

  final CqlTracing cqlTracing;
  final CqlEventKind kind;
  final boolean enabled;
  final List<O> observers;

  CqlObserverHandler(CqlTracing cqlTracing, CqlEventKind kind, boolean enabled,
    List<O> observers) {
    this.cqlTracing = cqlTracing;
    this.kind = kind;
    this.enabled = enabled;
    this.observers = observers;
  }

  final void handle(E event) {
    if (enabled) {
      HostAttributes host = hostAttributes(event);
      try {
        recordSpan(event, host);
      } catch (Throwable t) {
        propagateIfFatal(t);
        LOG.log(Level.FINE, "error recording span for " + event, t);
      }
      recordMetrics(event, host);
    }

    for (O observer : observers) {
      try {
        forward(observer, event);
      } catch (Throwable t) {
        propagateIfFatal(t);
        LOG.log(Level.WARNING, "observer " + observer + " failed on " + event, t);
      }
    }
  }

  /** Reads the host of the event. A host that fails to read has empty attributes. */
  HostAttributes hostAttributes(E event) {
    try {
      return HostAttributes.of(host(event));
    } catch (Throwable t) {
      propagateIfFatal(t);
      LOG.log(Level.FINE, "error reading the host of a " + kind.spanName() + " event", t);
      return HostAttributes.EMPTY;
    }
  }

  void recordSpan(E event, HostAttributes host) {
    Tracer tracer = cqlTracing.tracer();
    if (tracer == null) return; // no tracing component was configured or is current

    TraceContext parent = parent(event);
    Span span = parent != null ? tracer.newChild(parent) : tracer.newTrace();
    if (span.isNoop()) return;

    try {
      span.kind(CLIENT).remoteServiceName(REMOTE_SERVICE_NAME);
      if (!host.address().isEmpty()) span.remoteIpAndPort(host.address(), host.port());
      parse(event, host, span);
    } catch (Throwable t) {
      propagateIfFatal(t);
      LOG.log(Level.FINE, "error parsing " + event, t);
    } finally {
      long startTimestamp = epochMicros(start(event));
      if (startTimestamp == 0L) {
        span.start();
      } else {
        span.start(startTimestamp);
      }

      Throwable error = error(event);
      if (error != null) span.error(error);

      long finishTimestamp = epochMicros(end(event));
      if (finishTimestamp == 0L) {
        span.finish();
      } else {
        span.finish(finishTimestamp);
      }
    }
  }

  /** The span parent, or null to start a new trace. */
  @Nullable abstract TraceContext parent(E event);

  @Nullable abstract HostInfo host(E event);

  @Nullable abstract Instant start(E event);

  @Nullable abstract Instant end(E event);

  @Nullable abstract Throwable error(E event);

  abstract void parse(E event, HostAttributes host, Span span);

  abstract void recordMetrics(E event, HostAttributes host);

  abstract void forward(O observer, E event);

  /**
   * Reads a parent from the value the caller attached to the query or batch. Anything other than
   * a {@link TraceContext} or {@link Span} is ignored.
   */
  @Nullable static TraceContext attachedContext(@Nullable Object context) {
    if (context instanceof TraceContext) return (TraceContext) context;
    if (context instanceof Span) return ((Span) context).context();
    return null;
  }

  static long epochMicros(@Nullable Instant instant) {
    if (instant == null) return 0L;
    return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{enabled=" + enabled + ", observers=" + observers + "}";
  }
}
