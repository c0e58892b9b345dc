/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import cqltracing.driver.ObservedBatch;
import cqltracing.driver.ObservedConnect;
import cqltracing.driver.ObservedQuery;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;

public class CqlMetricsTest {
  SimpleMeterRegistry registry = new SimpleMeterRegistry();
  CqlMetrics metrics = new CqlMetrics(registry);
  HostAttributes host = new HostAttributes("127.0.0.1", 9042, "4.1.3", "", HostState.UP);

  @Test void query_noKeyspace() {
    metrics.query(ObservedQuery.newBuilder().statement("select now() from system.local").build(),
      host);

    assertThat(registry.get(CqlMetrics.QUERIES)
      .tag("cassandra.host", "127.0.0.1")
      .tag("cassandra.keyspace", "none")
      .counter().count()).isEqualTo(1.0);
  }

  @Test void latencyOnlyWithTimestamps() {
    metrics.connect(ObservedConnect.newBuilder().build(), host);

    assertThat(registry.find(CqlMetrics.LATENCY).timer()).isNull();

    Instant start = Instant.now();
    metrics.batch(ObservedBatch.newBuilder()
      .addStatement("delete from book where id = ?")
      .start(start)
      .end(start.plusMillis(7))
      .build(), host);

    assertThat(registry.get(CqlMetrics.LATENCY).tag("kind", "batch").timer()
      .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(7.0);
  }

  @Test void brokenRegistry_doesNotThrow() {
    CqlMetrics metrics = new CqlMetrics(mock(MeterRegistry.class));

    assertThatCode(() -> {
      metrics.connect(ObservedConnect.newBuilder().build(), host);
      metrics.query(ObservedQuery.newBuilder().build(), host);
      metrics.batch(ObservedBatch.newBuilder().build(), host);
    }).doesNotThrowAnyException();
  }
}
