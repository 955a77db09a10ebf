/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.handler;

import census.RootSpan;
import java.io.IOException;
import java.util.List;

/**
 * A listener that delivers finished traces to a backend. Implementations usually add each ended
 * root to an {@link ExporterBuffer}, which later calls {@link #publish(List)} with a batch.
 *
 * <p>Delivery is attempted once per batch. An exporter that needs retries keeps its own retry
 * queue.
 */
public interface Exporter extends SpanEventListener {

  /**
   * Sends a batch of finished traces.
   *
   * @throws IOException (or RuntimeException) when delivery fails. The batch is dropped by the
   * caller.
   */
  void publish(List<RootSpan> roots) throws IOException;
}
