/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

/** Rows returned by {@link Query#iter()}. */
public interface Iter {
  /** Copies the next row's columns into {@code dest}, returning false when no rows remain. */
  boolean scan(Object... dest);

  int numRows();

  /** Releases the iterator, throwing the error of the query if it failed. */
  void close();
}
