/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

/** Host liveness as tagged on spans. Compare case-insensitively. */
public enum HostState {
  UP,
  DOWN,
  UNKNOWN
}
