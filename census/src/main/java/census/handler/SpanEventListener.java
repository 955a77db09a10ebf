/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.handler;

import census.RootSpan;

/**
 * Receives lifecycle events of recorded traces. Only roots are reported: a listener sees a trace
 * when its root starts and again when its root ends, at which point every descendant has ended.
 *
 * <p>Exceptions thrown here are logged and ignored, so one broken listener cannot affect another
 * or the application being traced. Listeners may read the tree they are given, but must not mutate
 * it.
 */
public interface SpanEventListener {

  /** Called after a recorded root span starts. */
  void onStartSpan(RootSpan root);

  /** Called after a recorded root span and all of its descendants end. */
  void onEndSpan(RootSpan root);
}
