/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census;

import census.internal.Nullable;
import census.propagation.SpanContext;

/** How to create a span: its name, kind and, for roots, an optional remote parent. */
public final class SpanOptions {
  public static final String DEFAULT_NAME = "span";

  public static SpanOptions create(String name) {
    return newBuilder().name(name).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String name = DEFAULT_NAME;
    Span.Kind kind = Span.Kind.UNSPECIFIED;
    SpanContext parentContext;

    Builder() {
    }

    /** Defaults to "span". */
    public Builder name(String name) {
      if (name == null) throw new NullPointerException("name == null");
      this.name = name;
      return this;
    }

    public Builder kind(Span.Kind kind) {
      if (kind == null) throw new NullPointerException("kind == null");
      this.kind = kind;
      return this;
    }

    /**
     * Context of a parent in another process, usually extracted from request headers. Only read
     * when starting a root: the new root joins the parent's trace.
     */
    public Builder parentContext(@Nullable SpanContext parentContext) {
      this.parentContext = parentContext;
      return this;
    }

    public SpanOptions build() {
      return new SpanOptions(this);
    }
  }

  final String name;
  final Span.Kind kind;
  @Nullable final SpanContext parentContext;

  SpanOptions(Builder builder) {
    name = builder.name;
    kind = builder.kind;
    parentContext = builder.parentContext;
  }

  public String name() {
    return name;
  }

  public Span.Kind kind() {
    return kind;
  }

  @Nullable public SpanContext parentContext() {
    return parentContext;
  }

  @Override public String toString() {
    return "SpanOptions{name=" + name + ", kind=" + kind
      + (parentContext != null ? ", parentContext=" + parentContext : "") + "}";
  }
}
