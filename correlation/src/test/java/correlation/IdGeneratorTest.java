/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation;

import correlation.internal.Platform;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdGeneratorTest {
  IdGenerator generator = IdGenerator.random();

  @Test void random_traceId() {
    assertThat(generator.newTraceId()).matches("^[0-9a-f]{32}$");
  }

  @Test void random_spanId() {
    assertThat(generator.newSpanId())
      .matches("^[0-9a-f]{16}$")
      .isNotEqualTo("0000000000000000");
  }

  @Test void random_unique() {
    Set<String> traceIds = new LinkedHashSet<>();
    for (int i = 0; i < 1000; i++) {
      traceIds.add(generator.newTraceId());
    }
    assertThat(traceIds).hasSize(1000);
  }

  /** Truncating a trace ID must not make an invalid span ID */
  @Test void random_skipsZeroHighBits() {
    Platform platform = mock(Platform.class);
    when(platform.randomLong()).thenReturn(0L, 1L, 2L);

    try (MockedStatic<Platform> mb = mockStatic(Platform.class)) {
      mb.when(Platform::get).thenReturn(platform);

      assertThat(generator.newTraceId())
        .isEqualTo("0000000000000001" + "0000000000000002");
    }
    verify(platform, times(3)).randomLong();
  }

  @Test void newSpanId_truncatesTraceId() {
    IdGenerator fixed = () -> "463ac35c9f6413ad48485a3953bb6124";

    assertThat(fixed.newSpanId()).isEqualTo("463ac35c9f6413ad");
  }

  @Test void random_hasNiceToString() {
    assertThat(generator).hasToString("RandomIdGenerator{}");
  }
}
