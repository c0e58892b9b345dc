/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.Span;
import brave.propagation.TraceContext;
import cqltracing.driver.BatchObserver;
import cqltracing.driver.HostInfo;
import cqltracing.driver.ObservedBatch;
import java.time.Instant;

/**
 * Records one "batch-query" span per batch attempt, not one per statement, as a child of the
 * context attached to the batch.
 */
final class TracingBatchObserver extends CqlObserverHandler<ObservedBatch, BatchObserver>
  implements BatchObserver {

  TracingBatchObserver(CqlTracing cqlTracing) {
    super(cqlTracing, CqlEventKind.BATCH, cqlTracing.batchInstrumentation,
      cqlTracing.batchObservers);
  }

  @Override public void observeBatch(ObservedBatch batch) {
    handle(batch);
  }

  @Override TraceContext parent(ObservedBatch batch) {
    return attachedContext(batch.context());
  }

  @Override HostInfo host(ObservedBatch batch) {
    return batch.host();
  }

  @Override Instant start(ObservedBatch batch) {
    return batch.start();
  }

  @Override Instant end(ObservedBatch batch) {
    return batch.end();
  }

  @Override Throwable error(ObservedBatch batch) {
    return batch.error();
  }

  @Override void parse(ObservedBatch batch, HostAttributes host, Span span) {
    cqlTracing.parser.batch(batch, host, span.customizer());
  }

  @Override void recordMetrics(ObservedBatch batch, HostAttributes host) {
    cqlTracing.metrics.batch(batch, host);
  }

  @Override void forward(BatchObserver observer, ObservedBatch batch) {
    observer.observeBatch(batch);
  }
}
