/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation;

import correlation.internal.Platform;

/**
 * Provisions identifiers used when an inbound value is missing or must be discarded.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface IdGenerator {
  /** Returns a new 32 character lower-hex trace ID. */
  String newTraceId();

  /**
   * Returns a new 16 character lower-hex span ID. The default truncates a fresh {@linkplain
   * #newTraceId() trace ID}, so implementations need only supply one method.
   */
  default String newSpanId() {
    return newTraceId().substring(0, 16);
  }

  /**
   * Returns a generator backed by {@link Platform#randomLong()}. The leading 64 bits are never
   * zero, so {@link #newSpanId()} never returns all zeros either.
   */
  static IdGenerator random() {
    return RandomIdGenerator.INSTANCE;
  }
}
