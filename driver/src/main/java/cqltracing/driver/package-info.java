/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
/**
 * The observer contract a CQL driver exposes to instrumentation.
 *
 * <p>A {@link cqltracing.driver.ClusterConfig} has one slot per event kind. The driver invokes the
 * observer in a slot on whichever of its own threads completed the connection, query or batch. The
 * event types in this package are built by the driver and are read-only to observers.
 */
package cqltracing.driver;
