/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation;

import correlation.internal.HexCodec;
import correlation.internal.Platform;

final class RandomIdGenerator implements IdGenerator {
  static final IdGenerator INSTANCE = new RandomIdGenerator();

  @Override public String newTraceId() {
    Platform platform = Platform.get();
    long high;
    do {
      high = platform.randomLong();
    } while (high == 0L);
    return HexCodec.toLowerHex(high, platform.randomLong());
  }

  @Override public String toString() {
    return "RandomIdGenerator{}";
  }
}
