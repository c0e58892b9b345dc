/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

import java.util.List;

/**
 * Settings used to create a {@link Session}. Each observer slot holds at most one observer, which
 * the driver invokes for every event of that kind on sessions created afterwards.
 */
public interface ClusterConfig {
  List<String> hosts();

  int port();

  /** The keyspace sessions use by default, or null. */
  String keyspace();

  ConnectObserver connectObserver();

  void connectObserver(ConnectObserver connectObserver);

  QueryObserver queryObserver();

  void queryObserver(QueryObserver queryObserver);

  BatchObserver batchObserver();

  void batchObserver(BatchObserver batchObserver);

  /**
   * Connects to the cluster.
   *
   * @throws DriverException if no host could be reached
   */
  Session createSession();
}
