/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** Invoked once per query attempt, after the driver has the outcome. */
public interface QueryObserver {
  void observeQuery(ObservedQuery query);
}
