/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.IdGenerator;
import correlation.propagation.Propagation.Getter;
import correlation.propagation.Propagation.Setter;
import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;

/**
 * Reads a {@link TraceContext} from inbound {@code traceparent} and {@code request-id} headers, and
 * writes it to outbound ones.
 *
 * <p>Ex.
 * <pre>{@code
 * CorrelationPropagation propagation = CorrelationPropagation.create();
 * TraceContext context = propagation.extractor(Map<String, String>::get).extract(headers);
 * context.renewSpan();
 * propagation.injector(Map<String, String>::put).inject(context, outgoingHeaders);
 * }</pre>
 */
public final class CorrelationPropagation {
  static final String TRACEPARENT = "traceparent", REQUEST_ID = "request-id";

  public static CorrelationPropagation create() {
    return new Builder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    IdGenerator idGenerator = IdGenerator.random();
    boolean injectRequestId = true;

    /**
     * Used when inbound identifiers are absent or invalid. Defaults to {@link
     * IdGenerator#random()}
     */
    public Builder idGenerator(IdGenerator idGenerator) {
      if (idGenerator == null) throw new NullPointerException("idGenerator == null");
      this.idGenerator = idGenerator;
      return this;
    }

    /**
     * When true, the injector also writes {@link TraceContext#backCompatId()} as the {@code
     * request-id} header for older consumers. Defaults to true.
     */
    public Builder injectRequestId(boolean injectRequestId) {
      this.injectRequestId = injectRequestId;
      return this;
    }

    public CorrelationPropagation build() {
      return new CorrelationPropagation(this);
    }

    Builder() {
    }
  }

  final IdGenerator idGenerator;
  final boolean injectRequestId;
  final List<String> keys = Collections.unmodifiableList(asList(TRACEPARENT, REQUEST_ID));

  CorrelationPropagation(Builder builder) {
    this.idGenerator = builder.idGenerator;
    this.injectRequestId = builder.injectRequestId;
  }

  /** The propagation fields read and written, in precedence order. */
  public List<String> keys() {
    return keys;
  }

  public <R> TraceContext.Extractor<R> extractor(Getter<R, String> getter) {
    if (getter == null) throw new NullPointerException("getter == null");
    return new CorrelationExtractor<>(this, getter);
  }

  public <R> TraceContext.Injector<R> injector(Setter<R, String> setter) {
    if (setter == null) throw new NullPointerException("setter == null");
    return new CorrelationInjector<>(this, setter);
  }

  @Override public String toString() {
    return "CorrelationPropagation{idGenerator=" + idGenerator
      + ", injectRequestId=" + injectRequestId + "}";
  }
}
