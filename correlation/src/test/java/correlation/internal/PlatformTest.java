/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.internal;

import correlation.propagation.TraceContext;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformTest {
  Logger logger = Logger.getLogger(TraceContext.class.getName());
  List<LogRecord> records = new ArrayList<>();
  Handler handler = new Handler() {
    @Override public void publish(LogRecord record) {
      records.add(record);
    }

    @Override public void flush() {
    }

    @Override public void close() {
    }
  };
  Level originalLevel;

  @BeforeEach void captureLogs() {
    originalLevel = logger.getLevel();
    logger.addHandler(handler);
  }

  @AfterEach void restoreLogger() {
    logger.removeHandler(handler);
    logger.setLevel(originalLevel);
  }

  @Test void findPlatform_jre17() {
    assertThat(Platform.findPlatform()).hasToString("Jre17{}");
  }

  @Test void get_sameInstance() {
    assertThat(Platform.get()).isSameAs(Platform.get());
  }

  @Test void log_fine() {
    logger.setLevel(Level.FINE);

    Platform.get().log("Invalid input: more than one traceparent", null);

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.FINE);
    assertThat(records.get(0).getMessage()).isEqualTo("Invalid input: more than one traceparent");
  }

  @Test void log_parameter() {
    logger.setLevel(Level.FINE);
    Exception thrown = new IllegalStateException();

    Platform.get().log("Invalid input: ff {0}", "version", thrown);

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getParameters()).containsExactly("version");
    assertThat(records.get(0).getThrown()).isSameAs(thrown);
  }

  /** Untrusted input shouldn't fill logs at the default level */
  @Test void log_skippedAboveFine() {
    logger.setLevel(Level.INFO);

    Platform.get().log("Invalid input: ff {0}", "version", null);
    Platform.get().log("Invalid input: more than one traceparent", null);

    assertThat(records).isEmpty();
  }
}
