/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.propagation;

import correlation.IdGenerator;
import correlation.internal.Platform;

import static correlation.internal.HexCodec.isAllZeros;
import static correlation.internal.HexCodec.isLowerHex;
import static correlation.propagation.TraceContext.DEFAULT_TRACE_FLAG;
import static correlation.propagation.TraceContext.DEFAULT_VERSION;
import static correlation.propagation.TraceContext.isValidSpanId;
import static correlation.propagation.TraceContext.isValidTraceId;

/**
 * Implements https://w3c.github.io/trace-context/#traceparent-header
 *
 * <p>Unlike a strict parser, this never rejects input. Each check below repairs the fields it
 * finds invalid by resetting them to defaults or new identifiers. Checks run in a fixed order, as
 * later ones see fields repaired by earlier ones.
 */
final class TraceparentFormat {
  /** Version '00' has exactly this many fields, though future versions may have more. */
  static final int FIELD_COUNT = 4;

  static final int // instead of enum for smaller bytecode
    FIELD_VERSION = 1,
    FIELD_TRACE_ID = 2,
    FIELD_PARENT_ID = 3,
    FIELD_TRACE_FLAGS = 4;

  /** Writes all "traceparent" defined fields in the trace context to a hyphen delimited string. */
  static String writeTraceparent(TraceContext context) {
    return new StringBuilder(55)
      .append(context.version()).append('-')
      .append(context.traceId()).append('-')
      .append(context.spanId()).append('-')
      .append(context.traceFlag()).toString();
  }

  /**
   * Parses a single {@code traceparent} value, regenerating any field that cannot be trusted.
   *
   * @param traceparent a non-empty header value, possibly malformed
   * @param idGenerator used for any identifier that must be replaced
   */
  static TraceContext parseTraceparent(String traceparent, IdGenerator idGenerator) {
    Fields fields = new Fields(idGenerator);

    // When the header was sent more than once, we can't tell which one is right.
    if (traceparent.indexOf(',') != -1) {
      Platform.get().log("Invalid input: more than one traceparent", null);
      fields.newTraceId();
      fields.newSpanId();
      return fields.build();
    }

    String[] values = traceparent.trim().split("-", -1);
    fields.count = values.length;
    if (fields.count >= FIELD_COUNT) {
      fields.version = values[0];
      fields.traceId = values[1];
      fields.spanId = values[2];
      fields.traceFlag = values[3];
    } else { // discard when a field is missing
      fields.newTraceId();
      fields.newSpanId();
    }

    checkVersionIsHex(fields);
    checkVersion00FieldCount(fields);
    checkVersionNotFf(fields);
    checkVersionSupported(fields);
    checkTraceFlag(fields);
    checkTraceId(fields);
    checkSpanId(fields);
    return fields.build();
  }

  static void checkVersionIsHex(Fields fields) {
    if (isLowerHex(fields.version, 2)) return;
    log(FIELD_VERSION, "Invalid input: only valid characters are lower-hex for {0}");
    fields.version = DEFAULT_VERSION;
    fields.newTraceId();
  }

  /** This strict check needs to be revisited on each trace-context release. */
  static void checkVersion00FieldCount(Fields fields) {
    if (!"00".equals(fields.version) || fields.count == FIELD_COUNT) return;
    log(FIELD_VERSION, "Invalid input: expected exactly 4 fields for {0} 00");
    fields.newTraceId();
    fields.newSpanId();
  }

  // 8-bit unsigned 255 is disallowed https://w3c.github.io/trace-context/#version
  static void checkVersionNotFf(Fields fields) {
    if (!"ff".equals(fields.version)) return;
    log(FIELD_VERSION, "Invalid input: ff {0}");
    fields.version = DEFAULT_VERSION;
    fields.newTraceId();
    fields.newSpanId();
  }

  static void checkVersionSupported(Fields fields) {
    if (fields.version.charAt(0) == '0') return; // already lower-hex
    log(FIELD_VERSION, "Invalid input: unsupported {0}");
    fields.version = DEFAULT_VERSION;
  }

  static void checkTraceFlag(Fields fields) {
    if (isLowerHex(fields.traceFlag, 2)) return;
    log(FIELD_TRACE_FLAGS, "Invalid input: only valid characters are lower-hex for {0}");
    fields.traceFlag = DEFAULT_TRACE_FLAG;
    fields.newTraceId();
  }

  static void checkTraceId(Fields fields) {
    if (isValidTraceId(fields.traceId)) return;
    logInvalidId(FIELD_TRACE_ID, fields.traceId);
    fields.newTraceId();
  }

  /** An invalid span ID means we can't trust the rest of the header either. */
  static void checkSpanId(Fields fields) {
    if (isValidSpanId(fields.spanId)) return;
    logInvalidId(FIELD_PARENT_ID, fields.spanId);
    fields.newSpanId();
    fields.newTraceId();
  }

  static void logInvalidId(int field, String id) {
    if (isAllZeros(id)) {
      log(field, "Invalid input: read all zeros {0}");
    } else {
      log(field, "Invalid input: {0} is not lower-hex of the expected length");
    }
  }

  static void log(int fieldCode, String s) {
    String field;
    switch (fieldCode) {
      case FIELD_VERSION:
        field = "version";
        break;
      case FIELD_TRACE_ID:
        field = "trace ID";
        break;
      // Confusingly, w3c calls the span ID field parentId
      // https://w3c.github.io/trace-context/#parent-id
      case FIELD_PARENT_ID:
        field = "parent ID";
        break;
      case FIELD_TRACE_FLAGS:
        field = "trace flags";
        break;
      default:
        throw new AssertionError("field code unmatched: " + fieldCode);
    }
    Platform.get().log(s, field, null);
  }

  /** Fields as they are repaired. Starts with defaults. */
  static final class Fields {
    final IdGenerator idGenerator;
    int count;
    String version = DEFAULT_VERSION, traceId, spanId, traceFlag = DEFAULT_TRACE_FLAG;

    Fields(IdGenerator idGenerator) {
      this.idGenerator = idGenerator;
    }

    void newTraceId() {
      traceId = idGenerator.newTraceId();
    }

    void newSpanId() {
      spanId = idGenerator.newSpanId();
    }

    TraceContext build() {
      return new TraceContext(idGenerator, version, traceId, spanId, traceFlag,
        RequestIdFormat.writeRequestId(traceId, spanId), null);
    }
  }

  TraceparentFormat() {
  }
}
