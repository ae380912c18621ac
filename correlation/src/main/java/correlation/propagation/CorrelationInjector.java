/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.propagation.Propagation.Setter;

import static correlation.propagation.CorrelationPropagation.REQUEST_ID;
import static correlation.propagation.CorrelationPropagation.TRACEPARENT;

final class CorrelationInjector<R> implements TraceContext.Injector<R> {
  final Setter<R, String> setter;
  final boolean injectRequestId;

  CorrelationInjector(CorrelationPropagation propagation, Setter<R, String> setter) {
    this.setter = setter;
    this.injectRequestId = propagation.injectRequestId;
  }

  @Override public void inject(TraceContext context, R request) {
    if (context == null) throw new NullPointerException("context == null");
    if (request == null) throw new NullPointerException("request == null");
    setter.put(request, TRACEPARENT, context.serialize());
    if (injectRequestId) setter.put(request, REQUEST_ID, context.backCompatId());
  }

  @Override public String toString() {
    return "CorrelationInjector{setter=" + setter + "}";
  }
}
