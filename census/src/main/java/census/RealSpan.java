/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.HexCodec;
import census.internal.Nullable;
import census.internal.Platform;
import census.internal.collect.RingBuffer;
import census.propagation.SpanContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A span of a sampled trace. Instances record data until they end, after which they are read-only
 * and safe to hand to listeners.
 *
 * <p>The parent and children are held as IDs and resolved through the trace they belong to. All
 * reads and writes lock that trace, so listeners may read a tree from any thread.
 */
public class RealSpan extends Span {
  enum State {
    UNSTARTED,
    STARTED,
    ENDED
  }

  final TraceArena arena;
  final SpanContext context;
  final long parentId;

  // guarded by arena
  String name;
  Kind kind;
  Status status = Status.OK;
  final LinkedHashMap<String, Object> attributes = new LinkedHashMap<>();
  int droppedAttributesCount;
  final RingBuffer<Annotation> annotations;
  final RingBuffer<Link> links;
  final RingBuffer<MessageEvent> messageEvents;
  final ArrayList<Long> childIds = new ArrayList<>();
  State state = State.UNSTARTED;
  long startTimestamp, endTimestamp;

  RealSpan(TraceArena arena, SpanContext context, long parentId, SpanOptions options) {
    this.arena = arena;
    this.context = context;
    this.parentId = parentId;
    this.name = options.name();
    this.kind = options.kind();
    TraceParams params = arena.traceParams;
    this.annotations = new RingBuffer<>(params.maxAnnotationsPerSpan());
    this.links = new RingBuffer<>(params.maxLinksPerSpan());
    this.messageEvents = new RingBuffer<>(params.maxMessageEventsPerSpan());
  }

  @Override public boolean isNoop() {
    return false;
  }

  @Override public SpanContext context() {
    return context;
  }

  @Override public Span startChildSpan(SpanOptions options) {
    if (options == null) options = SpanOptions.newBuilder().build();
    RealSpan child;
    synchronized (arena) {
      if (state != State.STARTED) {
        Platform.get().log("creating a child of {0}, which is not running", this, null);
        return NoopSpan.childOf(context);
      }
      child = arena.newChild(this, options);
      childIds.add(child.context.spanId());
    }
    child.start();
    return child;
  }

  @Override public Span name(String name) {
    if (name == null) return this;
    synchronized (arena) {
      if (isEnded("name")) return this;
      this.name = name;
    }
    return this;
  }

  @Override public Span kind(Kind kind) {
    if (kind == null) return this;
    synchronized (arena) {
      if (isEnded("kind")) return this;
      this.kind = kind;
    }
    return this;
  }

  @Override public Span addAttribute(String key, String value) {
    if (value != null && value.length() > arena.maximumLabelValueSize) {
      value = value.substring(0, arena.maximumLabelValueSize);
    }
    return putAttribute(key, value);
  }

  @Override public Span addAttribute(String key, long value) {
    return putAttribute(key, value);
  }

  @Override public Span addAttribute(String key, double value) {
    return putAttribute(key, value);
  }

  @Override public Span addAttribute(String key, boolean value) {
    return putAttribute(key, value);
  }

  Span putAttribute(String key, Object value) {
    if (key == null || value == null) {
      Platform.get().log("ignoring attribute with null key or value on {0}", this, null);
      return this;
    }
    synchronized (arena) {
      if (isEnded("addAttribute")) return this;
      if (!attributes.containsKey(key)) {
        int max = arena.traceParams.maxAttributesPerSpan();
        if (max == 0) {
          droppedAttributesCount++;
          return this;
        }
        if (attributes.size() >= max) { // evict the oldest key
          Iterator<String> oldest = attributes.keySet().iterator();
          oldest.next();
          oldest.remove();
          droppedAttributesCount++;
        }
      }
      attributes.put(key, value);
    }
    return this;
  }

  @Override public Span addAnnotation(String description, Map<String, ?> attributes) {
    if (description == null || attributes == null) return this;
    synchronized (arena) {
      if (isEnded("addAnnotation")) return this;
      annotations.add(
        Annotation.create(arena.clock.currentTimeMicroseconds(), description, attributes));
    }
    return this;
  }

  @Override
  public Span addAnnotation(String description, Map<String, ?> attributes, long timestamp) {
    if (description == null || attributes == null) return this;
    synchronized (arena) {
      if (isEnded("addAnnotation")) return this;
      annotations.add(Annotation.create(timestamp, description, attributes));
    }
    return this;
  }

  @Override public Span addLink(String traceId, String spanId, Link.Type type,
    Map<String, ?> attributes) {
    if (traceId == null || spanId == null || type == null || attributes == null) return this;
    synchronized (arena) {
      if (isEnded("addLink")) return this;
      links.add(Link.create(traceId, spanId, type, attributes));
    }
    return this;
  }

  @Override public Span addMessageEvent(MessageEvent.Type type, long id, long timestamp,
    long uncompressedSize, long compressedSize) {
    if (type == null) return this;
    synchronized (arena) {
      if (isEnded("addMessageEvent")) return this;
      if (timestamp == 0L) timestamp = arena.clock.currentTimeMicroseconds();
      messageEvents.add(
        MessageEvent.create(timestamp, type, id, uncompressedSize, compressedSize));
    }
    return this;
  }

  @Override public Span setStatus(CanonicalCode code, @Nullable String message) {
    if (code == null) return this;
    synchronized (arena) {
      if (isEnded("setStatus")) return this;
      this.status = Status.create(code, message);
    }
    return this;
  }

  @Override public Span start() {
    synchronized (arena) {
      if (state != State.UNSTARTED) {
        Platform.get().log("calling start() on {0}, which was already started", this, null);
        return this;
      }
      state = State.STARTED;
      // the trace clock is shared, so a child starts from its parent's current time
      startTimestamp = arena.clock.currentTimeMicroseconds();
    }
    arena.tracer.onStartSpan(this);
    return this;
  }

  @Override public void end() {
    List<RealSpan> unfinished;
    synchronized (arena) {
      if (state == State.UNSTARTED) {
        Platform.get().warn("calling end() on {0}, which was never started", this);
        return;
      } else if (state == State.ENDED) {
        Platform.get().log("calling end() on {0}, which already ended", this, null);
        return;
      }
      state = State.ENDED;
      endTimestamp = arena.clock.currentTimeMicroseconds();
      unfinished = new ArrayList<>();
      for (Long childId : childIds) {
        RealSpan child = arena.spans.get(childId);
        if (child.state == State.STARTED) unfinished.add(child);
      }
    }
    // TODO: make truncation of running children a tracer option, for callers who end children
    // asynchronously after the parent returns
    for (RealSpan child : unfinished) {
      child.truncate();
    }
    arena.tracer.onEndSpan(this);
  }

  @Override public void truncate() {
    Platform.get().log("truncating {0}", this, null);
    end();
  }

  boolean isEnded(String operation) {
    if (state != State.ENDED) return false;
    Platform.get().log("ignoring " + operation + " on {0}, which already ended", this, null);
    return true;
  }

  /** The root of this trace. Returns itself when this is the root. */
  public RootSpan root() {
    return arena.root;
  }

  public boolean isRootSpan() {
    return false;
  }

  /** Returns the parent in this process, or null for the root. */
  @Nullable public RealSpan parent() {
    return parentId != 0L ? arena.get(parentId) : null;
  }

  /** Span ID of the parent, including a remote parent of the root, or zero if there is none. */
  public long parentId() {
    return parentId;
  }

  /** Lower-hex form of {@link #parentId()}, or null if there is no parent. */
  @Nullable public String parentSpanId() {
    return parentId != 0L ? HexCodec.toLowerHex(parentId) : null;
  }

  @Nullable public String traceState() {
    return context.traceState();
  }

  public String name() {
    synchronized (arena) {
      return name;
    }
  }

  public Kind kind() {
    synchronized (arena) {
      return kind;
    }
  }

  public Status status() {
    synchronized (arena) {
      return status;
    }
  }

  /** Returns a copy of the attributes in insertion order. */
  public Map<String, Object> attributes() {
    synchronized (arena) {
      if (attributes.isEmpty()) return Collections.emptyMap();
      return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
  }

  public List<Annotation> annotations() {
    synchronized (arena) {
      return annotations.toList();
    }
  }

  public List<Link> links() {
    synchronized (arena) {
      return links.toList();
    }
  }

  public List<MessageEvent> messageEvents() {
    synchronized (arena) {
      return messageEvents.toList();
    }
  }

  public int droppedAttributesCount() {
    synchronized (arena) {
      return droppedAttributesCount;
    }
  }

  public int droppedAnnotationsCount() {
    synchronized (arena) {
      return annotations.dropped();
    }
  }

  public int droppedLinksCount() {
    synchronized (arena) {
      return links.dropped();
    }
  }

  public int droppedMessageEventsCount() {
    synchronized (arena) {
      return messageEvents.dropped();
    }
  }

  /** Direct children in the order they were created. */
  public List<RealSpan> children() {
    synchronized (arena) {
      if (childIds.isEmpty()) return Collections.emptyList();
      List<RealSpan> result = new ArrayList<>(childIds.size());
      for (Long childId : childIds) {
        result.add(arena.spans.get(childId));
      }
      return Collections.unmodifiableList(result);
    }
  }

  public int numberOfChildren() {
    synchronized (arena) {
      return childIds.size();
    }
  }

  /** Every descendant, depth-first, each parent before its children. */
  public List<RealSpan> allDescendants() {
    List<RealSpan> result = new ArrayList<>();
    synchronized (arena) {
      addDescendants(this, result);
    }
    return Collections.unmodifiableList(result);
  }

  static void addDescendants(RealSpan span, List<RealSpan> result) {
    for (Long childId : span.childIds) {
      RealSpan child = span.arena.spans.get(childId);
      result.add(child);
      addDescendants(child, result);
    }
  }

  /** True once started, including after the span ended. */
  public boolean started() {
    synchronized (arena) {
      return state != State.UNSTARTED;
    }
  }

  public boolean ended() {
    synchronized (arena) {
      return state == State.ENDED;
    }
  }

  /** Epoch microseconds when the span started, or zero if it hasn't. */
  public long startTimestamp() {
    synchronized (arena) {
      return startTimestamp;
    }
  }

  /** Epoch microseconds when the span ended, or zero if it hasn't. */
  public long endTimestamp() {
    synchronized (arena) {
      return endTimestamp;
    }
  }

  /** Microseconds between start and end. While running, this is the time elapsed so far. */
  public long durationMicros() {
    synchronized (arena) {
      switch (state) {
        case ENDED:
          return endTimestamp - startTimestamp;
        case STARTED:
          return arena.clock.currentTimeMicroseconds() - startTimestamp;
        default:
          return 0L;
      }
    }
  }

  @Override public String toString() {
    synchronized (arena) {
      StringBuilder result = new StringBuilder(getClass().getSimpleName()).append('{')
        .append("traceId=").append(context.traceIdString());
      if (parentId != 0L) result.append(", parentId=").append(HexCodec.toLowerHex(parentId));
      result.append(", id=").append(context.spanIdString())
        .append(", name=").append(name);
      if (kind != Kind.UNSPECIFIED) result.append(", kind=").append(kind);
      if (state != State.UNSTARTED) result.append(", timestamp=").append(startTimestamp);
      if (state == State.ENDED) result.append(", duration=").append(endTimestamp - startTimestamp);
      if (!status.isOk()) result.append(", status=").append(status);
      if (!attributes.isEmpty()) result.append(", attributes=").append(attributes);
      if (annotations.size() > 0) result.append(", annotations=").append(annotations.toList());
      return result.append('}').toString();
    }
  }
}
