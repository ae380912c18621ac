/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.IdGenerator;
import correlation.internal.Platform;

import static correlation.propagation.TraceContext.DEFAULT_TRACE_FLAG;
import static correlation.propagation.TraceContext.DEFAULT_VERSION;
import static correlation.propagation.TraceContext.isValidTraceId;

/**
 * Reads and writes the hierarchical {@code Request-Id} format, which predates traceparent. Ex.
 * {@code |4bf92f3577b34da6a3ce929d0e0e4736.00f067aa0ba902b7.}
 *
 * <p>The leading segment is the root ID, which corresponds to a trace ID. Segments after it are
 * opaque, except the last which is read as the span ID.
 */
public final class RequestIdFormat {

  /** Returns the back-compatible Request-Id for the given IDs: {@code |traceId.spanId.} */
  public static String writeRequestId(String traceId, String spanId) {
    return new StringBuilder(traceId.length() + spanId.length() + 3)
      .append('|').append(traceId).append('.').append(spanId).append('.').toString();
  }

  /**
   * Returns the root segment of a Request-Id. A leading pipe is skipped and the result ends before
   * the first dot, or at the end when there is none.
   */
  public static String rootOf(String requestId) {
    if (requestId == null) throw new NullPointerException("requestId == null");
    int endIndex = requestId.indexOf('.');
    if (endIndex == -1) endIndex = requestId.length();
    int beginIndex = !requestId.isEmpty() && requestId.charAt(0) == '|' ? 1 : 0;
    return requestId.substring(beginIndex, endIndex);
  }

  /**
   * Reads the trace ID and span ID from a non-empty Request-Id. The input is retained as the {@link
   * TraceContext#parentId()}. When the root segment isn't a valid trace ID, it is retained as the
   * {@link TraceContext#legacyRootId()} and a new trace ID is used instead.
   *
   * <p>The span ID is used as given, without validation.
   */
  static TraceContext parseRequestId(String requestId, IdGenerator idGenerator) {
    String traceId = rootOf(requestId), legacyRootId = null;
    if (!isValidTraceId(traceId)) {
      Platform.get().log("Invalid input: {0} is not a trace ID", "root ID", null);
      legacyRootId = traceId;
      traceId = idGenerator.newTraceId();
    }

    String spanId = requestId;
    if (requestId.indexOf('|') != -1) { // innermost segment, without the trailing delimiter
      int lastIndex = requestId.length() - 1;
      spanId = requestId.substring(1 + requestId.lastIndexOf('.', lastIndex - 1), lastIndex);
    }

    return new TraceContext(idGenerator, DEFAULT_VERSION, traceId, spanId, DEFAULT_TRACE_FLAG,
      requestId, legacyRootId);
  }

  RequestIdFormat() {
  }
}
