/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.internal.Nullable;

/**
 * Seams used to read and write correlation headers without depending on a particular request
 * type, such as an HTTP server request or a message.
 */
public interface Propagation {
  /**
   * Replaces a propagated field with the given value. Saved as a constant to avoid runtime
   * allocations.
   *
   * For example, a setter for {@link java.net.HttpURLConnection} would be the method reference
   * {@link java.net.HttpURLConnection#addRequestProperty(String, String)}
   *
   * @param <R> usually an outgoing request or message
   * @param <K> usually, but not always, a String
   */
  interface Setter<R, K> {
    void put(R request, K key, String value);
  }

  /**
   * Gets the first value of the given propagation key or returns null.
   *
   * @param <R> usually an incoming request or message
   * @param <K> usually, but not always, a String
   */
  interface Getter<R, K> {
    @Nullable String get(R request, K key);
  }
}
