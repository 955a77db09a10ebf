/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Nullable;

/** Outcome of the operation a span represents. Spans start with {@link #OK}. */
public final class Status {
  public static final Status OK = new Status(CanonicalCode.OK, null);

  public static Status create(CanonicalCode code, @Nullable String message) {
    if (code == null) throw new NullPointerException("code == null");
    if (code == CanonicalCode.OK && message == null) return OK;
    return new Status(code, message);
  }

  final CanonicalCode code;
  @Nullable final String message;

  Status(CanonicalCode code, @Nullable String message) {
    this.code = code;
    this.message = message;
  }

  public CanonicalCode code() {
    return code;
  }

  @Nullable public String message() {
    return message;
  }

  public boolean isOk() {
    return code == CanonicalCode.OK;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Status)) return false;
    Status that = (Status) o;
    return code == that.code
      && (message == null ? that.message == null : message.equals(that.message));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= code.hashCode();
    h *= 1000003;
    h ^= message == null ? 0 : message.hashCode();
    return h;
  }

  @Override public String toString() {
    return message == null ? code.name() : code.name() + ": " + message;
  }
}
