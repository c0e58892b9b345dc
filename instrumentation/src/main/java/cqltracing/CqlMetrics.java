/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.internal.Nullable;
import cqltracing.driver.ObservedBatch;
import cqltracing.driver.ObservedConnect;
import cqltracing.driver.ObservedQuery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

import static brave.internal.Throwables.propagateIfFatal;

/**
 * Records CQL events into a {@link MeterRegistry}. Each method is independent of span recording
 * and never throws: a meter that cannot be registered is logged and skipped.
 */
final class CqlMetrics {
  static final Logger LOG = Logger.getLogger(CqlTracing.INSTRUMENTATION_NAME);

  static final String QUERIES = "db.cassandra.queries";
  static final String ROWS = "db.cassandra.rows";
  static final String BATCHES = "db.cassandra.batch.queries";
  static final String CONNECTIONS = "db.cassandra.connections";
  static final String ERRORS = "db.cassandra.errors";
  static final String LATENCY = "db.cassandra.latency";

  static final String TAG_KIND = "kind", TAG_OUTCOME = "outcome", NO_KEYSPACE = "none";

  final MeterRegistry registry;

  CqlMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  void connect(ObservedConnect connect, HostAttributes host) {
    try {
      Tags tags = Tags.of(CqlTraceKeys.HOST, host.address());
      Counter.builder(CONNECTIONS)
        .description("Connection attempts to Cassandra hosts")
        .tags(tags)
        .tag(TAG_OUTCOME, connect.error() == null ? "success" : "error")
        .register(registry)
        .increment();
      finish(CqlEventKind.CONNECT, tags, connect.start(), connect.end(), connect.error());
    } catch (Throwable t) {
      propagateIfFatal(t);
      LOG.log(Level.FINE, "error recording metrics for " + connect, t);
    }
  }

  void query(ObservedQuery query, HostAttributes host) {
    try {
      Tags tags = tags(host, query.keyspace());
      Counter.builder(QUERIES)
        .description("Queries executed, counting each attempt")
        .tags(tags)
        .register(registry)
        .increment();
      DistributionSummary.builder(ROWS)
        .description("Rows returned in the first page of a query")
        .tags(tags)
        .register(registry)
        .record(query.rows());
      finish(CqlEventKind.QUERY, tags, query.start(), query.end(), query.error());
    } catch (Throwable t) {
      propagateIfFatal(t);
      LOG.log(Level.FINE, "error recording metrics for " + query, t);
    }
  }

  void batch(ObservedBatch batch, HostAttributes host) {
    try {
      Tags tags = tags(host, batch.keyspace());
      Counter.builder(BATCHES)
        .description("Batches executed, counting each attempt")
        .tags(tags)
        .register(registry)
        .increment();
      finish(CqlEventKind.BATCH, tags, batch.start(), batch.end(), batch.error());
    } catch (Throwable t) {
      propagateIfFatal(t);
      LOG.log(Level.FINE, "error recording metrics for " + batch, t);
    }
  }

  void finish(CqlEventKind kind, Tags tags, @Nullable Instant start, @Nullable Instant end,
    @Nullable Throwable error) {
    Tags kindTags = tags.and(TAG_KIND, kind.metricValue());
    if (error != null) {
      Counter.builder(ERRORS)
        .description("Failed connection attempts, queries and batches")
        .tags(kindTags)
        .register(registry)
        .increment();
    }
    if (start != null && end != null) {
      Timer.builder(LATENCY)
        .description("Time from the start of an attempt until the driver had its outcome")
        .tags(kindTags)
        .register(registry)
        .record(Duration.between(start, end));
    }
  }

  static Tags tags(HostAttributes host, @Nullable String keyspace) {
    return Tags.of(CqlTraceKeys.HOST, host.address(), CqlTraceKeys.KEYSPACE,
      keyspace == null || keyspace.isEmpty() ? NO_KEYSPACE : keyspace);
  }
}
