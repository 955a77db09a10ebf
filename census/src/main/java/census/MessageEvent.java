/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

/** A message sent or received during the span, such as one frame of a streaming RPC. */
public final class MessageEvent {
  public enum Type {
    UNSPECIFIED,
    SENT,
    RECEIVED
  }

  public static MessageEvent create(long timestamp, Type type, long id, long uncompressedSize,
    long compressedSize) {
    if (type == null) throw new NullPointerException("type == null");
    return new MessageEvent(timestamp, type, id, uncompressedSize, compressedSize);
  }

  final long timestamp;
  final Type type;
  final long id, uncompressedSize, compressedSize;

  MessageEvent(long timestamp, Type type, long id, long uncompressedSize, long compressedSize) {
    this.timestamp = timestamp;
    this.type = type;
    this.id = id;
    this.uncompressedSize = uncompressedSize;
    this.compressedSize = compressedSize;
  }

  /** Epoch microseconds read from the trace clock. */
  public long timestamp() {
    return timestamp;
  }

  public Type type() {
    return type;
  }

  /** Identifies the message within the span, for example a sequence number. */
  public long id() {
    return id;
  }

  /** Size in bytes before compression, or zero if unknown. */
  public long uncompressedSize() {
    return uncompressedSize;
  }

  /** Size in bytes after compression, or zero if unknown. */
  public long compressedSize() {
    return compressedSize;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof MessageEvent)) return false;
    MessageEvent that = (MessageEvent) o;
    return timestamp == that.timestamp
      && type == that.type
      && id == that.id
      && uncompressedSize == that.uncompressedSize
      && compressedSize == that.compressedSize;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((timestamp >>> 32) ^ timestamp);
    h *= 1000003;
    h ^= type.hashCode();
    h *= 1000003;
    h ^= (int) ((id >>> 32) ^ id);
    h *= 1000003;
    h ^= (int) ((uncompressedSize >>> 32) ^ uncompressedSize);
    h *= 1000003;
    h ^= (int) ((compressedSize >>> 32) ^ compressedSize);
    return h;
  }

  @Override public String toString() {
    return "MessageEvent{timestamp=" + timestamp + ", type=" + type + ", id=" + id
      + ", uncompressedSize=" + uncompressedSize + ", compressedSize=" + compressedSize + "}";
  }
}
