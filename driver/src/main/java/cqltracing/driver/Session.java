/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing.driver;

import java.io.Closeable;

public interface Session extends Closeable {
  Query query(String statement, Object... values);

  Batch newBatch(BatchType type);

  void executeBatch(Batch batch);

  boolean isClosed();

  @Override void close();
}
