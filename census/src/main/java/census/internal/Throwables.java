/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.internal;

public final class Throwables {
  /**
   * Rethrows errors the JVM cannot recover from. Everything else is left for the caller to log, as
   * tracing code must not crash the application it observes.
   */
  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  Throwables() {
  }
}
