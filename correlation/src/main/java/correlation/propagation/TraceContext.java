/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.IdGenerator;
import correlation.internal.Nullable;

import static correlation.internal.HexCodec.isAllZeros;
import static correlation.internal.HexCodec.isLowerHex;

/**
 * Identifies the current operation and span, as read from inbound correlation headers.
 *
 * <p>Instances are always valid: construction never fails. Inbound values that cannot be trusted
 * are replaced with new identifiers from the {@link IdGenerator}. Use {@link #serialize()} for the
 * outgoing {@code traceparent} header and {@link #backCompatId()} for the outgoing {@code
 * Request-Id} header.
 *
 * <p>This type is not thread-safe, as {@link #renewSpan()} mutates it in place. Use one instance
 * per logical operation.
 */
public final class TraceContext {
  public static final String DEFAULT_VERSION = "00", DEFAULT_TRACE_FLAG = "01";

  /**
   * Used to send the trace context downstream. For example, as http headers.
   *
   * <p>For example, to put the context on an {@link java.net.HttpURLConnection}, you can do this:
   * <pre>{@code
   * // in your constructor
   * injector = propagation.injector(URLConnection::setRequestProperty);
   *
   * // later in your code, reuse the function you created above to add correlation headers
   * HttpURLConnection connection = (HttpURLConnection) new URL("http://myserver").openConnection();
   * injector.inject(context, connection);
   * }</pre>
   */
  public interface Injector<C> {
    /**
     * Usually calls a setter for each propagation field to send downstream.
     *
     * @param carrier holds propagation fields. For example, an outgoing message or http request.
     */
    void inject(TraceContext traceContext, C carrier);
  }

  /** Used to continue an incoming trace. For example, by reading http headers. */
  public interface Extractor<C> {

    /**
     * Returns a context parsed from the carrier. When nothing was usable, this is a new root
     * context, never null.
     *
     * @param carrier holds propagation fields. For example, an incoming message or http request.
     */
    TraceContext extract(C carrier);
  }

  /**
   * Implements the <a href="https://www.w3.org/TR/trace-context/#traceparent-header">traceparent</a>
   * and legacy Request-Id rules to select a context.
   *
   * <p>A non-empty {@code traceparent} wins. Otherwise a non-empty {@code requestId} is used.
   * Otherwise a new root context is created.
   */
  public static TraceContext create(@Nullable String traceparent, @Nullable String requestId) {
    return create(traceparent, requestId, IdGenerator.random());
  }

  /** Like {@link #create(String, String)}, except with a custom {@link IdGenerator}. */
  public static TraceContext create(@Nullable String traceparent, @Nullable String requestId,
    IdGenerator idGenerator) {
    if (idGenerator == null) throw new NullPointerException("idGenerator == null");
    if (traceparent != null && !traceparent.isEmpty()) {
      return TraceparentFormat.parseTraceparent(traceparent, idGenerator);
    } else if (requestId != null && !requestId.isEmpty()) {
      return RequestIdFormat.parseRequestId(requestId, idGenerator);
    }
    return newRoot(idGenerator);
  }

  /** Like {@link #create(String, String)}, when only a {@code traceparent} header was sent. */
  public static TraceContext fromTraceparent(String traceparent) {
    return create(traceparent, null);
  }

  /** Like {@link #create(String, String)}, when only a {@code Request-Id} header was sent. */
  public static TraceContext fromRequestId(String requestId) {
    return create(null, requestId);
  }

  /** Like {@link #newRoot(IdGenerator)}, using {@link IdGenerator#random()}. */
  public static TraceContext newRoot() {
    return newRoot(IdGenerator.random());
  }

  /** Creates a context with a new trace ID and span ID, and default version and flags. */
  public static TraceContext newRoot(IdGenerator idGenerator) {
    if (idGenerator == null) throw new NullPointerException("idGenerator == null");
    String traceId = idGenerator.newTraceId();
    String spanId = idGenerator.newSpanId();
    return new TraceContext(idGenerator, DEFAULT_VERSION, traceId, spanId, DEFAULT_TRACE_FLAG,
      RequestIdFormat.writeRequestId(traceId, spanId), null);
  }

  /** Returns true if the input is 32 lower-hex characters and not all zeros. */
  public static boolean isValidTraceId(@Nullable String traceId) {
    return isLowerHex(traceId, 32) && !isAllZeros(traceId);
  }

  /** Returns true if the input is 16 lower-hex characters and not all zeros. */
  public static boolean isValidSpanId(@Nullable String spanId) {
    return isLowerHex(spanId, 16) && !isAllZeros(spanId);
  }

  final IdGenerator idGenerator;
  final String version, traceId, traceFlag, parentId;
  @Nullable final String legacyRootId;
  String spanId; // mutated by renewSpan

  TraceContext(IdGenerator idGenerator, String version, String traceId, String spanId,
    String traceFlag, String parentId, @Nullable String legacyRootId) {
    this.idGenerator = idGenerator;
    this.version = version;
    this.traceId = traceId;
    this.spanId = spanId;
    this.traceFlag = traceFlag;
    this.parentId = parentId;
    this.legacyRootId = legacyRootId;
  }

  /** Two lower-hex characters, never "ff". */
  public String version() {
    return version;
  }

  /** 32 lower-hex characters identifying the overall operation. */
  public String traceId() {
    return traceId;
  }

  /** 16 lower-hex characters identifying the current unit of work, called parent-id in w3c. */
  public String spanId() {
    return spanId;
  }

  /** Two lower-hex characters, such as "01" for sampled. */
  public String traceFlag() {
    return traceFlag;
  }

  /**
   * The legacy correlation value of the caller. When read from a Request-Id, this is that header
   * verbatim. Otherwise, it is the {@link #backCompatId()} as of construction.
   *
   * <p>Note: This is not updated by {@link #renewSpan()}.
   */
  public String parentId() {
    return parentId;
  }

  /**
   * The root segment of an inbound Request-Id when it could not be used as a trace ID, or null.
   * This is kept for diagnostics, typically as a custom dimension.
   */
  @Nullable public String legacyRootId() {
    return legacyRootId;
  }

  /** Returns the current state in the legacy Request-Id format: {@code |traceId.spanId.} */
  public String backCompatId() {
    return RequestIdFormat.writeRequestId(traceId, spanId);
  }

  /** Returns the current state in traceparent format: {@code version-traceId-spanId-flags} */
  public String serialize() {
    return TraceparentFormat.writeTraceparent(this);
  }

  /** Replaces the {@link #spanId()}, as done when entering a child span of the same trace. */
  public void renewSpan() {
    spanId = idGenerator.newSpanId();
  }

  @Override public String toString() {
    return serialize();
  }
}
