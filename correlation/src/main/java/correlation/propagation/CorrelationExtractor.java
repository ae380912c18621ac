/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.propagation.Propagation.Getter;

import static correlation.propagation.CorrelationPropagation.REQUEST_ID;
import static correlation.propagation.CorrelationPropagation.TRACEPARENT;

final class CorrelationExtractor<R> implements TraceContext.Extractor<R> {
  final Getter<R, String> getter;
  final CorrelationPropagation propagation;

  CorrelationExtractor(CorrelationPropagation propagation, Getter<R, String> getter) {
    this.getter = getter;
    this.propagation = propagation;
  }

  @Override public TraceContext extract(R request) {
    if (request == null) throw new NullPointerException("request == null");
    String traceparent = getter.get(request, TRACEPARENT);
    // request-id is only consulted when traceparent is absent
    String requestId =
      traceparent == null || traceparent.isEmpty() ? getter.get(request, REQUEST_ID) : null;
    return TraceContext.create(traceparent, requestId, propagation.idGenerator);
  }

  @Override public String toString() {
    return "CorrelationExtractor{getter=" + getter + "}";
  }
}
