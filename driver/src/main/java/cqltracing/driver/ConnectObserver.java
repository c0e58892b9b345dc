/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** Invoked once per connection attempt the driver makes to a host. */
public interface ConnectObserver {
  void observeConnect(ObservedConnect connect);
}
