/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package census.exporter.zipkin;

import census.Annotation;
import census.MessageEvent;
import census.RealSpan;
import census.Status;
import census.propagation.SpanContext;
import java.util.Locale;
import java.util.Map;
import zipkin2.Endpoint;
import zipkin2.Span;

/** Maps one recorded span to the Zipkin v2 model. */
final class SpanConverter {
  static final String STATUS_CODE_TAG = "census.status_code";
  static final String ERROR_TAG = "error";

  final Endpoint localEndpoint;

  SpanConverter(String localServiceName) {
    // non-Zipkin models allow mixed case service names, but Zipkin does not.
    this.localEndpoint = Endpoint.newBuilder()
      .serviceName(localServiceName.toLowerCase(Locale.ROOT))
      .build();
  }

  Span convert(RealSpan span) {
    SpanContext context = span.context();
    Span.Builder result = Span.newBuilder()
      .traceId(context.traceIdHigh(), context.traceId())
      .id(context.spanId())
      .name(span.name())
      .localEndpoint(localEndpoint);
    if (span.parentId() != 0L) result.parentId(span.parentId());

    long start = span.startTimestamp(), end = span.endTimestamp();
    if (start != 0L) result.timestamp(start);
    if (start != 0L && end != 0L) result.duration(Math.max(end - start, 1));

    switch (span.kind()) {
      case SERVER:
        result.kind(Span.Kind.SERVER);
        break;
      case CLIENT:
        result.kind(Span.Kind.CLIENT);
        break;
      default:
        break;
    }

    for (Map.Entry<String, Object> attribute : span.attributes().entrySet()) {
      result.putTag(attribute.getKey(), String.valueOf(attribute.getValue()));
    }

    Status status = span.status();
    if (!status.isOk()) {
      result.putTag(STATUS_CODE_TAG, status.code().name());
      result.putTag(ERROR_TAG, status.message() != null ? status.message() : status.code().name());
    }

    for (Annotation annotation : span.annotations()) {
      result.addAnnotation(annotation.timestamp(), annotation.description());
    }

    for (MessageEvent event : span.messageEvents()) {
      result.addAnnotation(event.timestamp(), messageEventValue(event));
    }
    return result.build();
  }

  /** Ex. "message.sent id=1 uncompressed=300 compressed=120" */
  static String messageEventValue(MessageEvent event) {
    StringBuilder result = new StringBuilder("message");
    if (event.type() != MessageEvent.Type.UNSPECIFIED) {
      result.append('.').append(event.type().name().toLowerCase(Locale.ROOT));
    }
    result.append(" id=").append(event.id());
    if (event.uncompressedSize() != 0L) {
      result.append(" uncompressed=").append(event.uncompressedSize());
    }
    if (event.compressedSize() != 0L) {
      result.append(" compressed=").append(event.compressedSize());
    }
    return result.toString();
  }

  @Override public String toString() {
    return "SpanConverter{localEndpoint=" + localEndpoint + "}";
  }
}
