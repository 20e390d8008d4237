package com.codeheadsystems.totp.rfc4648;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base32 encoding from RFC 4648 sections 6 and 7.
 * <p>
 * Bytes are processed in groups of five (40 bits), each group mapping to eight 5-bit symbols,
 * most significant bits first. A trailing partial group is zero-filled on the right and the
 * output is completed with {@code =} padding. Decoding skips any character that is neither an
 * alphabet symbol nor padding, so wrapped or hand-typed text decodes the same as compact text.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public class Base32Codec {

  /**
   * Maximum encoded line length when wrapping is requested.
   */
  public static final int LINE_LENGTH = 72;

  private static final int GROUP_BYTES = 5;
  private static final int GROUP_SYMBOLS = 8;

  // Indexed by bytes in the group: symbols carrying real data.
  private static final int[] SYMBOLS_FOR_BYTES = {0, 2, 4, 5, 7, 8};
  // Indexed by symbols before padding: bytes emitted for the partial group.
  private static final int[] BYTES_FOR_SYMBOLS = {0, 1, 1, 1, 2, 3, 3, 4};

  private static final Base32Codec STANDARD = new Base32Codec(Base32Alphabet.STANDARD);
  private static final Base32Codec HEX = new Base32Codec(Base32Alphabet.HEX);

  private final Base32Alphabet alphabet;

  /**
   * Instantiates a new Base32 codec.
   *
   * @param alphabet the alphabet
   */
  public Base32Codec(final Base32Alphabet alphabet) {
    this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
  }

  /**
   * The codec for the standard {@code A-Z2-7} alphabet.
   *
   * @return the base 32 codec
   */
  public static Base32Codec standard() {
    return STANDARD;
  }

  /**
   * The codec for the extended hex {@code 0-9A-V} alphabet.
   *
   * @return the base 32 codec
   */
  public static Base32Codec hex() {
    return HEX;
  }

  /**
   * Alphabet.
   *
   * @return the base 32 alphabet
   */
  public Base32Alphabet alphabet() {
    return alphabet;
  }

  /**
   * Encodes without line wrapping.
   *
   * @param bytes the bytes
   * @return the padded base32 text
   */
  public String encode(final byte[] bytes) {
    return encode(bytes, false);
  }

  /**
   * Encodes the bytes as padded base32 text.
   *
   * @param bytes     the bytes, possibly empty
   * @param wrapLines if true, output is split into {@value #LINE_LENGTH}-character lines, each
   *                  terminated by a newline
   * @return the text, empty for empty input
   */
  public String encode(final byte[] bytes, final boolean wrapLines) {
    Objects.requireNonNull(bytes, "bytes");
    final int groups = (bytes.length + GROUP_BYTES - 1) / GROUP_BYTES;
    final StringBuilder out = new StringBuilder(groups * (GROUP_SYMBOLS + 1) + 1);
    int lineLength = 0;
    for (int i = 0; i < bytes.length; i += GROUP_BYTES) {
      final int n = Math.min(GROUP_BYTES, bytes.length - i);
      long group = 0;
      for (int j = 0; j < GROUP_BYTES; j++) {
        group <<= 8;
        if (j < n) {
          group |= bytes[i + j] & 0xFF;
        }
      }
      final int symbols = SYMBOLS_FOR_BYTES[n];
      for (int s = 0; s < GROUP_SYMBOLS; s++) {
        if (s < symbols) {
          out.append(alphabet.symbol((int) (group >>> (35 - 5 * s))));
        } else {
          out.append(Base32Alphabet.PAD);
        }
      }
      lineLength += GROUP_SYMBOLS;
      if (wrapLines && lineLength == LINE_LENGTH) {
        out.append('\n');
        lineLength = 0;
      }
    }
    if (wrapLines && lineLength > 0) {
      out.append('\n');
    }
    return out.toString();
  }

  /**
   * Decodes base32 text.
   * <p>
   * Characters outside the alphabet are skipped. The first {@code =} ends decoding; the pending
   * partial group is completed with zero bits and only the bytes its symbols reach are emitted.
   *
   * @param text the text
   * @return the decoded bytes
   * @throws MalformedInputException if the text ends part way through a group without padding
   */
  public byte[] decode(final CharSequence text) {
    Objects.requireNonNull(text, "text");
    final byte[] out = new byte[decodedCapacity(text.length())];
    int written = 0;
    long group = 0;
    int count = 0;
    boolean padded = false;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == Base32Alphabet.PAD) {
        padded = true;
        break;
      }
      final int value = alphabet.value(c);
      if (value < 0) {
        continue;
      }
      group = (group << 5) | value;
      count++;
      if (count == GROUP_SYMBOLS) {
        written = emit(group, GROUP_BYTES, out, written);
        group = 0;
        count = 0;
      }
    }
    if (count > 0) {
      if (!padded) {
        throw new MalformedInputException((GROUP_SYMBOLS - count) * 5);
      }
      group <<= 5 * (GROUP_SYMBOLS - count);
      written = emit(group, BYTES_FOR_SYMBOLS[count], out, written);
    }
    return Arrays.copyOf(out, written);
  }

  /**
   * Upper bound on the bytes decoded from {@code chars} characters, computed in {@code long}.
   *
   * @param chars the input length
   * @return the buffer size
   */
  static int decodedCapacity(final int chars) {
    return (int) (chars * 5L / GROUP_SYMBOLS) + GROUP_BYTES;
  }

  private static int emit(final long group, final int byteCount, final byte[] out, final int offset) {
    for (int b = 0; b < byteCount; b++) {
      out[offset + b] = (byte) (group >>> (32 - 8 * b));
    }
    return offset + byteCount;
  }
}
