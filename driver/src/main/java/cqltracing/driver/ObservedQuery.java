/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

import java.time.Instant;

/** A completed attempt to execute one statement. */
public final class ObservedQuery {
  public static Builder newBuilder() {
    return new Builder();
  }

  final String keyspace, statement;
  final Object context;
  final HostInfo host;
  final Instant start, end;
  final int rows, attempt;
  final Throwable error;

  ObservedQuery(Builder builder) {
    keyspace = builder.keyspace;
    statement = builder.statement;
    context = builder.context;
    host = builder.host;
    start = builder.start;
    end = builder.end;
    rows = builder.rows;
    attempt = builder.attempt;
    error = builder.error;
  }

  /** The session's keyspace, or null if none is in use. */
  public String keyspace() {
    return keyspace;
  }

  public String statement() {
    return statement;
  }

  /** The value passed to {@link Query#withContext(Object)}, or null. */
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

  /** Rows in the first page of the result. */
  public int rows() {
    return rows;
  }

  /** Zero on the first attempt, incremented on each retry. */
  public int attempt() {
    return attempt;
  }

  /** Null when the query succeeded. */
  public Throwable error() {
    return error;
  }

  @Override public String toString() {
    return "ObservedQuery{statement=" + statement + ", attempt=" + attempt
      + ", error=" + error + "}";
  }

  public static final class Builder {
    String keyspace, statement;
    Object context;
    HostInfo host;
    Instant start, end;
    int rows, attempt;
    Throwable error;

    Builder() {
    }

    public Builder keyspace(String keyspace) {
      this.keyspace = keyspace;
      return this;
    }

    public Builder statement(String statement) {
      this.statement = statement;
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

    public Builder rows(int rows) {
      this.rows = rows;
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

    public ObservedQuery build() {
      return new ObservedQuery(this);
    }
  }
}
