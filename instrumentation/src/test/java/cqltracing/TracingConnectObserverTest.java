/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.ScopedSpan;
import brave.Tracing;
import brave.handler.MutableSpan;
import brave.test.TestSpanHandler;
import cqltracing.driver.ConnectObserver;
import cqltracing.driver.DriverException;
import cqltracing.driver.NodeState;
import cqltracing.driver.ObservedConnect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class TracingConnectObserverTest {
  TestSpanHandler spans = new TestSpanHandler();
  Tracing tracing = Tracing.newBuilder().addSpanHandler(spans).build();
  SimpleMeterRegistry registry = new SimpleMeterRegistry();
  FakeHost host = new FakeHost("127.0.0.1", 9042, "4.1.3", null, NodeState.UP);
  Instant start = Instant.now();

  @AfterEach void close() {
    tracing.close();
  }

  ConnectObserver observer(CqlTracingCustomizer... options) {
    CqlTracing.Builder builder = CqlTracing.newBuilder(tracing).meterRegistry(registry);
    for (CqlTracingCustomizer option : options) option.customize(builder);
    return builder.build().connectObserver();
  }

  ObservedConnect connect(Throwable error) {
    return ObservedConnect.newBuilder()
      .host(host).start(start).end(start.plusMillis(1)).error(error).build();
  }

  @Test void span() {
    observer().observeConnect(connect(null));

    MutableSpan span = spans.get(0);
    assertThat(span.name()).isEqualTo("connect");
    assertThat(span.parentId()).isNull();
    assertThat(span.tags())
      .containsEntry("cassandra.host", "127.0.0.1")
      .containsEntry("cassandra.port", "9042")
      .containsEntry("cassandra.version", "4.1.3")
      .containsEntry("cassandra.host.state", "UP")
      .doesNotContainKey("cassandra.host.id")
      .doesNotContainKey("cassandra.stmt");
  }

  /** Connections are shared, so they are not attributed to whichever span is current. */
  @Test void newTraceEvenWhenSpanInScope() {
    ScopedSpan parent = tracing.tracer().startScopedSpan("parent");
    try {
      observer().observeConnect(connect(null));
    } finally {
      parent.finish();
    }

    MutableSpan connect = spans.get(0);
    assertThat(connect.name()).isEqualTo("connect");
    assertThat(connect.parentId()).isNull();
    assertThat(connect.traceId()).isNotEqualTo(parent.context().traceIdString());
  }

  @Test void downHost() {
    host.state = NodeState.DOWN;

    observer().observeConnect(connect(new DriverException("connection refused")));

    assertThat(spans.get(0).tags()).containsEntry("cassandra.host.state", "DOWN");
    assertThat(spans.get(0).error()).hasMessage("connection refused");
  }

  @Test void metrics_countByOutcome() {
    ConnectObserver observer = observer();
    observer.observeConnect(connect(null));
    observer.observeConnect(connect(null));
    observer.observeConnect(connect(new DriverException("connection refused")));

    assertThat(registry.get(CqlMetrics.CONNECTIONS).tag("outcome", "success").counter().count())
      .isEqualTo(2.0);
    assertThat(registry.get(CqlMetrics.CONNECTIONS).tag("outcome", "error").counter().count())
      .isEqualTo(1.0);
    assertThat(registry.get(CqlMetrics.ERRORS).tag("kind", "connect").counter().count())
      .isEqualTo(1.0);
  }

  @Test void disabled_stillCallsObserver() {
    ConnectObserver extra = mock(ConnectObserver.class);
    ObservedConnect connect = connect(null);

    observer(b -> b.connectInstrumentation(false), b -> b.addConnectObserver(extra))
      .observeConnect(connect);

    assertThat(spans.spans()).isEmpty();
    assertThat(registry.getMeters()).isEmpty();
    verify(extra).observeConnect(connect);
  }
}
