/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import java.util.Locale;

/** The driver events this library observes. Each is independently enabled in {@link CqlTracing}. */
public enum CqlEventKind {
  CONNECT("connect"),
  QUERY("query"),
  BATCH("batch-query");

  final String spanName;

  CqlEventKind(String spanName) {
    this.spanName = spanName;
  }

  /** The span name used for this kind of event. Dashboards may key on these values. */
  public String spanName() {
    return spanName;
  }

  /** The value of the "kind" tag on metrics. */
  String metricValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
