/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** Liveness of a host as last seen by the driver. */
public enum NodeState {
  UP,
  DOWN
}
