/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.handler.RecordingExporter;
import census.propagation.ThreadLocalCurrentContext;
import census.sampler.Sampler;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class RealSpanTest {
  RecordingExporter exporter = RecordingExporter.create();
  Tracer tracer = Tracer.create(ThreadLocalCurrentContext.create()).start(TracingConfig.newBuilder()
    .sampler(Sampler.ALWAYS_SAMPLE)
    .maximumLabelValueSize(10)
    .traceParams(TraceParams.newBuilder()
      .maxAttributesPerSpan(2)
      .maxAnnotationsPerSpan(2)
      .maxLinksPerSpan(2)
      .maxMessageEventsPerSpan(2)
      .build())
    .addSpanEventListener(exporter)
    .build());
  RootSpan root = (RootSpan) tracer.newRootSpan(SpanOptions.create("root"));

  @AfterEach void stop() {
    tracer.stop();
  }

  @Test void newRoot_isStarted() {
    assertThat(root.started()).isTrue();
    assertThat(root.ended()).isFalse();
    assertThat(root.startTimestamp()).isPositive();
    assertThat(root.name()).isEqualTo("root");
    assertThat(root.isRootSpan()).isTrue();
    assertThat(root.isNoop()).isFalse();
    assertThat(root.context().sampled()).isTrue();
    assertThat(exporter.started()).containsExactly(root);
  }

  @Test void start_whenStartedIsNoop() {
    long startTimestamp = root.startTimestamp();

    root.start();

    assertThat(root.startTimestamp()).isEqualTo(startTimestamp);
    assertThat(exporter.started()).containsExactly(root);
  }

  @Test void end_isIdempotent() {
    root.end();
    long endTimestamp = root.endTimestamp();

    root.end();

    assertThat(root.endTimestamp()).isEqualTo(endTimestamp);
    assertThat(exporter.ended()).containsExactly(root);
  }

  @Test void end_recordsOrderedTimestamps() {
    root.end();

    assertThat(root.endTimestamp()).isGreaterThanOrEqualTo(root.startTimestamp());
    assertThat(root.durationMicros()).isEqualTo(root.endTimestamp() - root.startTimestamp());
  }

  @Test void end_unstartedIsNoop() {
    RealSpan unstarted;
    synchronized (root.arena) {
      unstarted = root.arena.newChild(root, SpanOptions.create("unstarted"));
    }

    unstarted.end();

    assertThat(unstarted.started()).isFalse();
    assertThat(unstarted.ended()).isFalse();
    assertThat(unstarted.endTimestamp()).isZero();
    assertThat(unstarted.durationMicros()).isZero();
  }

  @Test void end_truncatesRunningChildren() {
    RealSpan child = (RealSpan) root.startChildSpan("child");
    RealSpan grandchild = (RealSpan) child.startChildSpan("grandchild");

    root.end();

    assertThat(child.ended()).isTrue();
    assertThat(grandchild.ended()).isTrue();
    assertThat(child.endTimestamp()).isGreaterThanOrEqualTo(root.endTimestamp());
    assertThat(grandchild.endTimestamp()).isGreaterThanOrEqualTo(child.endTimestamp());
  }

  @Test void end_leavesEndedChildrenAlone() {
    RealSpan child = (RealSpan) root.startChildSpan("child");
    child.end();
    long childEnd = child.endTimestamp();

    root.end();

    assertThat(child.endTimestamp()).isEqualTo(childEnd);
  }

  /** Only roots are reported, and only once everything below them ended. */
  @Test void end_childDoesntNotifyListeners() {
    root.startChildSpan("child").end();

    assertThat(exporter.ended()).isEmpty();

    root.end();

    assertThat(exporter.ended()).containsExactly(root);
    assertThat(root.allDescendants()).allMatch(RealSpan::ended);
  }

  @Test void truncate_endsTheSpan() {
    Span child = root.startChildSpan("child");

    child.truncate();

    assertThat(((RealSpan) child).ended()).isTrue();
  }

  @Test void startChildSpan_linksParentAndChild() {
    RealSpan child = (RealSpan) root.startChildSpan("child");

    assertThat(child.started()).isTrue();
    assertThat(child.isRootSpan()).isFalse();
    assertThat(child.parent()).isSameAs(root);
    assertThat(child.root()).isSameAs(root);
    assertThat(child.parentId()).isEqualTo(root.context().spanId());
    assertThat(child.parentSpanId()).isEqualTo(root.context().spanIdString());
    assertThat(child.context().traceIdHigh()).isEqualTo(root.context().traceIdHigh());
    assertThat(child.context().traceId()).isEqualTo(root.context().traceId());
    assertThat(child.context().spanId()).isNotEqualTo(root.context().spanId());
    assertThat(child.context().sampled()).isTrue();
    assertThat(root.children()).containsExactly(child);
    assertThat(root.numberOfChildren()).isEqualTo(1);
  }

  @Test void startChildSpan_startsFromParentClock() {
    RealSpan child = (RealSpan) root.startChildSpan("child");

    assertThat(child.startTimestamp()).isGreaterThanOrEqualTo(root.startTimestamp());
  }

  @Test void startChildSpan_afterEndReturnsNoop() {
    root.end();

    Span child = root.startChildSpan("child");

    assertThat(child.isNoop()).isTrue();
    assertThat(child.context().traceId()).isEqualTo(root.context().traceId());
    assertThat(child.context().spanId()).isNotEqualTo(root.context().spanId());
    assertThat(child.context().sampled()).isTrue();
    assertThat(root.children()).isEmpty();
  }

  @Test void startChildSpan_ofUnstartedReturnsNoop() {
    RealSpan unstarted;
    synchronized (root.arena) {
      unstarted = root.arena.newChild(root, SpanOptions.create("unstarted"));
    }

    assertThat(unstarted.startChildSpan("child").isNoop()).isTrue();
    assertThat(unstarted.children()).isEmpty();
  }

  @Test void startChildSpan_usesOptions() {
    RealSpan child = (RealSpan) root.startChildSpan(SpanOptions.newBuilder()
      .name("get")
      .kind(Span.Kind.CLIENT)
      .build());

    assertThat(child.name()).isEqualTo("get");
    assertThat(child.kind()).isEqualTo(Span.Kind.CLIENT);
  }

  @Test void spanIds_uniqueWithinTrace() {
    Set<Long> ids = new LinkedHashSet<>();
    ids.add(root.context().spanId());
    for (int i = 0; i < 100; i++) {
      ids.add(root.startChildSpan("child").context().spanId());
    }

    assertThat(ids).hasSize(101).doesNotContain(0L);
    assertThat(root.spanCount()).isEqualTo(101);
  }

  @Test void allDescendants_depthFirstPreOrder() {
    RealSpan a = (RealSpan) root.startChildSpan("a");
    RealSpan a1 = (RealSpan) a.startChildSpan("a1");
    RealSpan b = (RealSpan) root.startChildSpan("b");
    RealSpan a2 = (RealSpan) a.startChildSpan("a2");

    assertThat(root.allDescendants()).containsExactly(a, a1, a2, b);
    assertThat(a.allDescendants()).containsExactly(a1, a2);
    assertThat(b.allDescendants()).isEmpty();
  }

  @Test void addAnnotation_evictsOldest() {
    root.addAnnotation("one");
    root.addAnnotation("two");
    root.addAnnotation("three");

    assertThat(root.annotations()).extracting(Annotation::description)
      .containsExactly("two", "three");
    assertThat(root.droppedAnnotationsCount()).isEqualTo(1);
  }

  @Test void addAnnotation_explicitTimestampAndAttributes() {
    root.addAnnotation("cache.miss", Collections.singletonMap("key", "user/1"), 1000L);

    assertThat(root.annotations()).containsExactly(
      Annotation.create(1000L, "cache.miss", Collections.singletonMap("key", "user/1")));
  }

  @Test void addLink_evictsOldest() {
    root.addLink("1", "1", Link.Type.PARENT_LINKED_SPAN);
    root.addLink("2", "2", Link.Type.CHILD_LINKED_SPAN);
    root.addLink("3", "3", Link.Type.UNSPECIFIED);

    assertThat(root.links()).extracting(Link::spanId).containsExactly("2", "3");
    assertThat(root.droppedLinksCount()).isEqualTo(1);
  }

  @Test void addMessageEvent_evictsOldest() {
    root.addMessageEvent(MessageEvent.Type.SENT, 1L);
    root.addMessageEvent(MessageEvent.Type.RECEIVED, 2L);
    root.addMessageEvent(MessageEvent.Type.SENT, 3L, 5000L, 300L, 120L);

    assertThat(root.messageEvents()).extracting(MessageEvent::id).containsExactly(2L, 3L);
    assertThat(root.messageEvents().get(1))
      .isEqualTo(MessageEvent.create(5000L, MessageEvent.Type.SENT, 3L, 300L, 120L));
    assertThat(root.droppedMessageEventsCount()).isEqualTo(1);
  }

  @Test void addMessageEvent_defaultsTimestampToTraceClock() {
    root.addMessageEvent(MessageEvent.Type.SENT, 1L);

    assertThat(root.messageEvents().get(0).timestamp())
      .isGreaterThanOrEqualTo(root.startTimestamp());
  }

  @Test void addAttribute_overwritesByKey() {
    root.addAttribute("k1", "a");
    root.addAttribute("k2", "b");
    root.addAttribute("k1", "c");

    assertThat(root.attributes()).containsExactly(entry("k1", "c"), entry("k2", "b"));
    assertThat(root.droppedAttributesCount()).isZero();
  }

  @Test void addAttribute_newKeyEvictsOldest() {
    root.addAttribute("k1", "a");
    root.addAttribute("k2", "b");
    root.addAttribute("k3", "c");

    assertThat(root.attributes()).containsExactly(entry("k2", "b"), entry("k3", "c"));
    assertThat(root.droppedAttributesCount()).isEqualTo(1);
  }

  @Test void addAttribute_truncatesLongStrings() {
    root.addAttribute("http.url", "http://localhost:8080/api/v2/spans");

    assertThat(root.attributes()).containsEntry("http.url", "http://loc");
  }

  @Test void addAttribute_primitives() {
    root.addAttribute("count", 3L);
    root.addAttribute("ratio", 0.5d);

    assertThat(root.attributes()).containsExactly(entry("count", 3L), entry("ratio", 0.5d));

    root.addAttribute("cached", true);

    assertThat(root.attributes()).containsExactly(entry("ratio", 0.5d), entry("cached", true));
  }

  @Test void nullInputsAreIgnored() {
    root.addAttribute(null, "value");
    root.addAttribute("key", (String) null);
    root.addAnnotation(null);
    root.addLink(null, "1", Link.Type.UNSPECIFIED);
    root.addMessageEvent(null, 1L);
    root.setStatus(null);
    root.name(null);
    root.kind(null);

    assertThat(root.attributes()).isEmpty();
    assertThat(root.annotations()).isEmpty();
    assertThat(root.links()).isEmpty();
    assertThat(root.messageEvents()).isEmpty();
    assertThat(root.status()).isEqualTo(Status.OK);
    assertThat(root.name()).isEqualTo("root");
    assertThat(root.kind()).isEqualTo(Span.Kind.UNSPECIFIED);
  }

  @Test void setStatus() {
    root.setStatus(CanonicalCode.NOT_FOUND, "no such user");

    assertThat(root.status().code()).isEqualTo(CanonicalCode.NOT_FOUND);
    assertThat(root.status().message()).isEqualTo("no such user");
    assertThat(root.status().isOk()).isFalse();
  }

  @Test void mutationsAfterEndAreIgnored() {
    root.end();

    root.name("renamed");
    root.kind(Span.Kind.SERVER);
    root.addAttribute("key", "value");
    root.addAnnotation("late");
    root.addLink("1", "1", Link.Type.UNSPECIFIED);
    root.addMessageEvent(MessageEvent.Type.SENT, 1L);
    root.setStatus(CanonicalCode.INTERNAL);

    assertThat(root.name()).isEqualTo("root");
    assertThat(root.kind()).isEqualTo(Span.Kind.UNSPECIFIED);
    assertThat(root.attributes()).isEmpty();
    assertThat(root.annotations()).isEmpty();
    assertThat(root.links()).isEmpty();
    assertThat(root.messageEvents()).isEmpty();
    assertThat(root.status()).isEqualTo(Status.OK);
  }

  @Test void traceParams_sharedByDescendants() {
    RealSpan child = (RealSpan) root.startChildSpan("child");
    child.addAnnotation("one");
    child.addAnnotation("two");
    child.addAnnotation("three");

    assertThat(child.annotations()).hasSize(2);
    assertThat(root.traceParams().maxAnnotationsPerSpan()).isEqualTo(2);
  }

  @Test void zeroCapacityDropsEverything() {
    Tracer tracer = Tracer.create(ThreadLocalCurrentContext.create()).start(TracingConfig.newBuilder()
      .sampler(Sampler.ALWAYS_SAMPLE)
      .traceParams(TraceParams.newBuilder().maxAttributesPerSpan(0).maxAnnotationsPerSpan(0).build())
      .build());
    RealSpan root = (RealSpan) tracer.newRootSpan(SpanOptions.create("root"));

    root.addAttribute("key", "value");
    root.addAnnotation("one");

    assertThat(root.attributes()).isEmpty();
    assertThat(root.droppedAttributesCount()).isEqualTo(1);
    assertThat(root.annotations()).isEmpty();
    assertThat(root.droppedAnnotationsCount()).isEqualTo(1);
  }

  @Test void identifiers_areLowerHex() {
    assertThat(root.traceId()).hasSize(32).matches("[0-9a-f]+");
    assertThat(root.id()).hasSize(16).matches("[0-9a-f]+");
    assertThat(root.parentSpanId()).isNull();
    assertThat(root.parent()).isNull();
  }

  @Test void toString_includesIdentity() {
    root.addAttribute("key", "value");

    assertThat(root.toString())
      .startsWith("RootSpan{traceId=" + root.traceId())
      .contains("id=" + root.id(), "name=root", "attributes={key=value}");
  }
}
