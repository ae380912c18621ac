/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package correlation.internal;

public final class HexCodec {

  /**
   * Returns true if the input is exactly {@code length} characters, each of them lower-hex. No
   * prefix is allowed.
   */
  public static boolean isLowerHex(@Nullable CharSequence value, int length) {
    if (value == null || value.length() != length) return false;
    for (int i = 0; i < length; i++) {
      char c = value.charAt(i);
      if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) return false;
    }
    return true;
  }

  /** Returns true if the input is non-empty and only contains the character '0'. */
  public static boolean isAllZeros(CharSequence value) {
    int length = value.length();
    if (length == 0) return false;
    for (int i = 0; i < length; i++) {
      if (value.charAt(i) != '0') return false;
    }
    return true;
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static String toLowerHex(long high, long low) {
    char[] data = new char[32];
    writeHexLong(data, 0, high);
    writeHexLong(data, 16, low);
    return new String(data);
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static void writeHexLong(char[] data, int pos, long v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 56L) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 48L) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 40L) & 0xff));
    writeHexByte(data, pos + 6, (byte) ((v >>> 32L) & 0xff));
    writeHexByte(data, pos + 8, (byte) ((v >>> 24L) & 0xff));
    writeHexByte(data, pos + 10, (byte) ((v >>> 16L) & 0xff));
    writeHexByte(data, pos + 12, (byte) ((v >>> 8L) & 0xff));
    writeHexByte(data, pos + 14, (byte) (v & 0xff));
  }

  static final char[] HEX_DIGITS =
    {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

  static void writeHexByte(char[] data, int pos, byte b) {
    data[pos + 0] = HEX_DIGITS[(b >> 4) & 0xf];
    data[pos + 1] = HEX_DIGITS[b & 0xf];
  }

  HexCodec() {
  }
}
