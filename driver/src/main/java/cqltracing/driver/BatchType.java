/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

public enum BatchType {
  LOGGED,
  UNLOGGED,
  COUNTER
}
