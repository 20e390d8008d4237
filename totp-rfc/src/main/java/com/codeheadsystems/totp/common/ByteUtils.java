package com.codeheadsystems.totp.common;

/**
 * Utility methods for big-endian octet string encoding.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative long to a big-endian octet string of the specified length.
   *
   * @param value  the value
   * @param length the length, 0 to 8
   * @return the byte [ ]
   */
  public static byte[] I2OSP(long value, int length) {
    if (length < 0 || length > 8) {
      throw new IllegalArgumentException("Length must be between 0 and 8: " + length);
    }
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Reads four bytes starting at {@code offset} as a big-endian 32-bit integer.
   *
   * @param bytes  the bytes
   * @param offset the offset of the most significant byte
   * @return the int
   */
  public static int readInt(byte[] bytes, int offset) {
    if (offset < 0 || offset + 4 > bytes.length) {
      throw new IllegalArgumentException("Need 4 bytes at offset " + offset + ", have " + bytes.length);
    }
    return ((bytes[offset] & 0xFF) << 24)
        | ((bytes[offset + 1] & 0xFF) << 16)
        | ((bytes[offset + 2] & 0xFF) << 8)
        | (bytes[offset + 3] & 0xFF);
  }
}
