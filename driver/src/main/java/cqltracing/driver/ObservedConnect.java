/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

import java.time.Instant;

/** A completed connection attempt. */
public final class ObservedConnect {
  public static Builder newBuilder() {
    return new Builder();
  }

  final HostInfo host;
  final Instant start, end;
  final Throwable error;

  ObservedConnect(Builder builder) {
    host = builder.host;
    start = builder.start;
    end = builder.end;
    error = builder.error;
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

  /** Null when the connection was established. */
  public Throwable error() {
    return error;
  }

  @Override public String toString() {
    return "ObservedConnect{host=" + (host != null ? host.address() : null)
      + ", error=" + error + "}";
  }

  public static final class Builder {
    HostInfo host;
    Instant start, end;
    Throwable error;

    Builder() {
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

    public Builder error(Throwable error) {
      this.error = error;
      return this;
    }

    public ObservedConnect build() {
      return new ObservedConnect(this);
    }
  }
}
