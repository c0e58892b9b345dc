/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Span;
import brave.propagation.TraceContext;
import cqltracing.driver.ConnectObserver;
import cqltracing.driver.HostInfo;
import cqltracing.driver.ObservedConnect;
import java.time.Instant;

/**
 * Records a "connect" span per connection attempt.
 *
 * <p>Connect spans always start a new trace. The driver pools connections and shares them across
 * queries, so a connection opened while a query is in flight is not part of that query.
 */
final class TracingConnectObserver extends CqlObserverHandler<ObservedConnect, ConnectObserver>
  implements ConnectObserver {

  TracingConnectObserver(CqlTracing cqlTracing) {
    super(cqlTracing, CqlEventKind.CONNECT, cqlTracing.connectInstrumentation,
      cqlTracing.connectObservers);
  }

  @Override public void observeConnect(ObservedConnect connect) {
    handle(connect);
  }

  @Override TraceContext parent(ObservedConnect connect) {
    return null;
  }

  @Override HostInfo host(ObservedConnect connect) {
    return connect.host();
  }

  @Override Instant start(ObservedConnect connect) {
    return connect.start();
  }

  @Override Instant end(ObservedConnect connect) {
    return connect.end();
  }

  @Override Throwable error(ObservedConnect connect) {
    return connect.error();
  }

  @Override void parse(ObservedConnect connect, HostAttributes host, Span span) {
    cqlTracing.parser.connect(connect, host, span.customizer());
  }

  @Override void recordMetrics(ObservedConnect connect, HostAttributes host) {
    cqlTracing.metrics.connect(connect, host);
  }

  @Override void forward(ConnectObserver observer, ObservedConnect connect) {
    observer.observeConnect(connect);
  }
}
