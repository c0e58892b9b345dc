/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A completed attempt to execute a batch. One event covers every statement in the batch. */
public final class ObservedBatch {
  public static Builder newBuilder() {
    return new Builder();
  }

  final String keyspace;
  final List<String> statements;
  final Object context;
  final HostInfo host;
  final Instant start, end;
  final int attempt;
  final Throwable error;

  ObservedBatch(Builder builder) {
    keyspace = builder.keyspace;
    statements = Collections.unmodifiableList(new ArrayList<>(builder.statements));
    context = builder.context;
    host = builder.host;
    start = builder.start;
    end = builder.end;
    attempt = builder.attempt;
    error = builder.error;
  }

  public String keyspace() {
    return keyspace;
  }

  /** Statements in the order they were added to the batch. */
  public List<String> statements() {
    return statements;
  }

  /** The value passed to {@link Batch#withContext(Object)}, or null. */
  public Object context() {
    return context;
  }

  public HostInfo host() {
    return host;
  }

  public Instant start() {
    return start;
  }

  public Instant end() {
    return end;
  }

  public int attempt() {
    return attempt;
  }

  /** Null when the batch succeeded. */
  public Throwable error() {
    return error;
  }

  @Override public String toString() {
    return "ObservedBatch{statements=" + statements.size() + ", attempt=" + attempt
      + ", error=" + error + "}";
  }

  public static final class Builder {
    String keyspace;
    final List<String> statements = new ArrayList<>();
    Object context;
    HostInfo host;
    Instant start, end;
    int attempt;
    Throwable error;

    Builder() {
    }

    public Builder keyspace(String keyspace) {
      this.keyspace = keyspace;
      return this;
    }

    public Builder addStatement(String statement) {
      if (statement == null) throw new NullPointerException("statement == null");
      statements.add(statement);
      return this;
    }

    public Builder statements(List<String> statements) {
      this.statements.clear();
      for (String statement : statements) addStatement(statement);
      return this;
    }

    public Builder context(Object context) {
      this.context = context;
      return this;
    }

    public Builder host(HostInfo host) {
      this.host = host;
      return this;
    }

    public Builder start(Instant start) {
      this.start = start;
      return this;
    }

    public Builder end(Instant end) {
      this.end = end;
      return this;
    }

    public Builder attempt(int attempt) {
      this.attempt = attempt;
      return this;
    }

    public Builder error(Throwable error) {
      this.error = error;
      return this;
    }

    public ObservedBatch build() {
      return new ObservedBatch(this);
    }
  }
}
