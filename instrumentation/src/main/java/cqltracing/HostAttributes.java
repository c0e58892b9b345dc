/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

import brave.internal.Nullable;
import cqltracing.driver.HostInfo;
import cqltracing.driver.NodeState;

/**
 * The host-level attributes every CQL span carries. Read fresh from the driver on each event, as a
 * host can go down between two queries.
 *
 * <p>Missing driver values become empty strings, zero or {@link HostState#UNKNOWN}.
 */
public final class HostAttributes {
  static final HostAttributes EMPTY = new HostAttributes("", 0, "", "", HostState.UNKNOWN);

  public static HostAttributes of(@Nullable HostInfo host) {
    if (host == null) return EMPTY;
    return new HostAttributes(
      nullToEmpty(host.address()),
      Math.max(host.port(), 0),
      nullToEmpty(host.version()),
      nullToEmpty(host.hostId()),
      state(host.state())
    );
  }

  final String address, version, hostId;
  final int port;
  final HostState state;

  HostAttributes(String address, int port, String version, String hostId, HostState state) {
    this.address = address;
    this.port = port;
    this.version = version;
    this.hostId = hostId;
    this.state = state;
  }

  public String address() {
    return address;
  }

  public int port() {
    return port;
  }

  /** The Cassandra release version of the host, not the native protocol version. */
  public String version() {
    return version;
  }

  public String hostId() {
    return hostId;
  }

  public HostState state() {
    return state;
  }

  @Override public String toString() {
    return "HostAttributes{address=" + address + ", port=" + port + ", version=" + version
      + ", state=" + state + "}";
  }

  static HostState state(@Nullable NodeState state) {
    if (state == null) return HostState.UNKNOWN;
    switch (state) {
      case UP:
        return HostState.UP;
      case DOWN:
        return HostState.DOWN;
      default:
        return HostState.UNKNOWN;
    }
  }

  static String nullToEmpty(@Nullable String value) {
    return value != null ? value : "";
  }
}
