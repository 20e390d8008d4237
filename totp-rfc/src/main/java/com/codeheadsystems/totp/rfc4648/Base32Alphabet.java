package com.codeheadsystems.totp.rfc4648;

import java.util.Arrays;

/**
 * The 32-symbol alphabets defined by RFC 4648.
 * <ul>
 *   <li>STANDARD: {@code A-Z2-7}, section 6</li>
 *   <li>HEX: {@code 0-9A-V}, section 7 ("base32hex")</li>
 * </ul>
 */
public enum Base32Alphabet {

  /**
   * RFC 4648 section 6 alphabet, the one used for TOTP secrets.
   */
  STANDARD("ABCDEFGHIJKLMNOPQRSTUVWXYZ234567"),
  /**
   * RFC 4648 section 7 extended hex alphabet.
   */
  HEX("0123456789ABCDEFGHIJKLMNOPQRSTUV");

  /**
   * The padding character shared by both alphabets.
   */
  public static final char PAD = '=';

  private final char[] symbols;
  private final int[] lookup;

  Base32Alphabet(String symbols) {
    this.symbols = symbols.toCharArray();
    this.lookup = new int[128];
    Arrays.fill(lookup, -1);
    for (int i = 0; i < this.symbols.length; i++) {
      lookup[this.symbols[i]] = i;
    }
  }

  /**
   * Returns the symbol for a 5-bit value.
   *
   * @param value 0 to 31
   * @return the symbol
   */
  public char symbol(int value) {
    return symbols[value & 0x1F];
  }

  /**
   * Returns the 5-bit value of a symbol, or -1 if the character is not part of this alphabet.
   *
   * @param c the character
   * @return 0 to 31, or -1
   */
  public int value(char c) {
    return c < lookup.length ? lookup[c] : -1;
  }
}
