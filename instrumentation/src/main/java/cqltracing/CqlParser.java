/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.SpanCustomizer;
import brave.internal.Nullable;
import cqltracing.driver.ObservedBatch;
import cqltracing.driver.ObservedConnect;
import cqltracing.driver.ObservedQuery;
import java.util.List;

/**
 * Provides reasonable defaults for the data contained in CQL spans. Subclass to customize, for
 * example, to drop the statement text or add tags of your own.
 *
 * <p>Every span is tagged with the {@linkplain #host(HostAttributes, SpanCustomizer) host
 * attributes}. Errors are not parsed here: the observers call {@link brave.Span#error(Throwable)}.
 */
public class CqlParser {
  static final CqlParser DEFAULT = new CqlParser();

  /**
   * Names the span "connect" and adds host tags. Override to add data from the connection attempt.
   */
  public void connect(ObservedConnect connect, HostAttributes host, SpanCustomizer span) {
    span.name(spanName(CqlEventKind.CONNECT));
    host(host, span);
  }

  /**
   * Names the span "query", adds host tags, {@link CqlTraceKeys#STATEMENT} and the keyspace, row
   * count and attempt when known.
   */
  public void query(ObservedQuery query, HostAttributes host, SpanCustomizer span) {
    span.name(spanName(CqlEventKind.QUERY));
    host(host, span);
    keyspace(query.keyspace(), span);
    if (query.statement() != null) span.tag(CqlTraceKeys.STATEMENT, query.statement());
    span.tag(CqlTraceKeys.ROWS_RETURNED, Integer.toString(query.rows()));
    attempt(query.attempt(), span);
  }

  /**
   * Names the span "batch-query", adds host tags and all statements of the batch as the single
   * tag {@link CqlTraceKeys#BATCH_STATEMENTS}.
   */
  public void batch(ObservedBatch batch, HostAttributes host, SpanCustomizer span) {
    span.name(spanName(CqlEventKind.BATCH));
    host(host, span);
    keyspace(batch.keyspace(), span);
    span.tag(CqlTraceKeys.BATCH_STATEMENTS, joinStatements(batch.statements()));
    span.tag(CqlTraceKeys.BATCH_SIZE, Integer.toString(batch.statements().size()));
    attempt(batch.attempt(), span);
  }

  /** Returns the span name of the event. Defaults to {@link CqlEventKind#spanName()}. */
  protected String spanName(CqlEventKind kind) {
    return kind.spanName();
  }

  /** Tags host, port, version and state. The host ID is only tagged when known. */
  protected void host(HostAttributes host, SpanCustomizer span) {
    span.tag(CqlTraceKeys.HOST, host.address());
    span.tag(CqlTraceKeys.PORT, Integer.toString(host.port()));
    span.tag(CqlTraceKeys.VERSION, host.version());
    span.tag(CqlTraceKeys.HOST_STATE, host.state().name());
    if (!host.hostId().isEmpty()) span.tag(CqlTraceKeys.HOST_ID, host.hostId());
  }

  static void keyspace(@Nullable String keyspace, SpanCustomizer span) {
    if (keyspace != null && !keyspace.isEmpty()) span.tag(CqlTraceKeys.KEYSPACE, keyspace);
  }

  static void attempt(int attempt, SpanCustomizer span) {
    if (attempt > 0) span.tag(CqlTraceKeys.ATTEMPTS, Integer.toString(attempt));
  }

  static String joinStatements(List<String> statements) {
    return String.join(CqlTraceKeys.BATCH_STATEMENT_SEPARATOR, statements);
  }
}
