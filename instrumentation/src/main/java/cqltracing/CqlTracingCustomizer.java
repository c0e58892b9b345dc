/*
 * Copyright The CQL Tracing Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package cqltracing;

/**
 * A configuration option for {@link CqlTracing}. Options are applied in order: later ones win for
 * settings such as the tracing component or a category toggle, while observers accumulate.
 *
 * <p>Ex.
 * <pre>{@code
 * TracingSession session = TracingSession.create(cluster,
 *   b -> b.tracing(tracing),
 *   b -> b.connectInstrumentation(false),
 *   b -> b.addQueryObserver(slowQueryLogger));
 * }</pre>
 *
 * @see TracingSession#create(cqltracing.driver.ClusterConfig, CqlTracingCustomizer...)
 */
@FunctionalInterface
public interface CqlTracingCustomizer {
  /** Use to avoid comparing against null references */
  CqlTracingCustomizer NOOP = new CqlTracingCustomizer() {
    @Override public void customize(CqlTracing.Builder builder) {
    }

    @Override public String toString() {
      return "NoopCqlTracingCustomizer{}";
    }
  };

  void customize(CqlTracing.Builder builder);
}
