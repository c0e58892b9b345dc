/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/**
 * The physical node an event happened against. Any accessor may return null, or zero for the port,
 * when the driver has not learned the value yet. Values can change between events.
 */
public interface HostInfo {
  /** The IP address or host name connected to, or null. */
  String address();

  int port();

  /** The Cassandra release version the node reports, or null. */
  String version();

  /** The node's host ID, or null if not yet read from the system tables. */
  String hostId();

  /** Null when the driver has no liveness information. */
  NodeState state();
}
