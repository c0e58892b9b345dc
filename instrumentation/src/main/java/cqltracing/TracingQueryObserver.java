/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Span;
import brave.propagation.TraceContext;
import cqltracing.driver.HostInfo;
import cqltracing.driver.ObservedQuery;
import cqltracing.driver.QueryObserver;
import java.time.Instant;

/**
 * Records a "query" span per query attempt, as a child of the context attached to the query.
 */
final class TracingQueryObserver extends CqlObserverHandler<ObservedQuery, QueryObserver>
  implements QueryObserver {

  TracingQueryObserver(CqlTracing cqlTracing) {
    super(cqlTracing, CqlEventKind.QUERY, cqlTracing.queryInstrumentation,
      cqlTracing.queryObservers);
  }

  @Override public void observeQuery(ObservedQuery query) {
    handle(query);
  }

  @Override TraceContext parent(ObservedQuery query) {
    return attachedContext(query.context());
  }

  @Override HostInfo host(ObservedQuery query) {
    return query.host();
  }

  @Override Instant start(ObservedQuery query) {
    return query.start();
  }

  @Override Instant end(ObservedQuery query) {
    return query.end();
  }

  @Override Throwable error(ObservedQuery query) {
    return query.error();
  }

  @Override void parse(ObservedQuery query, HostAttributes host, Span span) {
    cqlTracing.parser.query(query, host, span.customizer());
  }

  @Override void recordMetrics(ObservedQuery query, HostAttributes host) {
    cqlTracing.metrics.query(query, host);
  }

  @Override void forward(QueryObserver observer, ObservedQuery query) {
    observer.observeQuery(query);
  }
}
