/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

/** The canonical status codes, numbered as in the gRPC status space. */
public enum CanonicalCode {
  OK(0),
  CANCELLED(1),
  UNKNOWN(2),
  INVALID_ARGUMENT(3),
  DEADLINE_EXCEEDED(4),
  NOT_FOUND(5),
  ALREADY_EXISTS(6),
  PERMISSION_DENIED(7),
  RESOURCE_EXHAUSTED(8),
  FAILED_PRECONDITION(9),
  ABORTED(10),
  OUT_OF_RANGE(11),
  UNIMPLEMENTED(12),
  INTERNAL(13),
  UNAVAILABLE(14),
  DATA_LOSS(15),
  UNAUTHENTICATED(16);

  final int value;

  CanonicalCode(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /** Returns the code with the given numeric value, or {@link #UNKNOWN} if out of range. */
  public static CanonicalCode fromValue(int value) {
    CanonicalCode[] codes = values();
    if (value < 0 || value >= codes.length) return UNKNOWN;
    return codes[value];
  }
}
