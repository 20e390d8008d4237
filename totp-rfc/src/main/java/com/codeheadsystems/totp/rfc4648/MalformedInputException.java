package com.codeheadsystems.totp.rfc4648;

/**
 * Thrown when base32 text ends part way through a group without padding.
 */
public class MalformedInputException extends IllegalArgumentException {

  private final int missingBits;

  /**
   * Instantiates a new Malformed input exception.
   *
   * @param missingBits the number of bits needed to complete the final 40-bit group
   */
  public MalformedInputException(final int missingBits) {
    super(missingBits + " bits missing");
    this.missingBits = missingBits;
  }

  /**
   * The number of bits needed to complete the final 40-bit group.
   *
   * @return the int
   */
  public int missingBits() {
    return missingBits;
  }
}
