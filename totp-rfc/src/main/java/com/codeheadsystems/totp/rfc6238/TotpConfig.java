package com.codeheadsystems.totp.rfc6238;

/**
 * Time step and code length for TOTP generation.
 *
 * @param stepSeconds the time step, at least one second
 * @param digits      the decimal code length, 1 to 9
 */
public record TotpConfig(int stepSeconds, int digits) {

  /**
   * Default step per RFC 6238 section 5.2.
   */
  public static final int DEFAULT_STEP_SECONDS = 30;
  /**
   * Default code length.
   */
  public static final int DEFAULT_DIGITS = 6;
  /**
   * Largest code length a 31-bit truncated value can fill.
   */
  public static final int MAX_DIGITS = 9;

  /**
   * The classic 30 second, 6 digit profile.
   */
  public static final TotpConfig DEFAULT = new TotpConfig(DEFAULT_STEP_SECONDS, DEFAULT_DIGITS);

  /**
   * Validates the fields.
   */
  public TotpConfig {
    if (stepSeconds < 1) {
      throw new IllegalArgumentException("stepSeconds must be positive: " + stepSeconds);
    }
    if (digits < 1 || digits > MAX_DIGITS) {
      throw new IllegalArgumentException("digits must be between 1 and " + MAX_DIGITS + ": " + digits);
    }
  }

  /**
   * Returns a copy with the given code length.
   *
   * @param digits the digits
   * @return the totp config
   */
  public TotpConfig withDigits(int digits) {
    return new TotpConfig(stepSeconds, digits);
  }

  /**
   * Returns a copy with the given time step.
   *
   * @param stepSeconds the step seconds
   * @return the totp config
   */
  public TotpConfig withStepSeconds(int stepSeconds) {
    return new TotpConfig(stepSeconds, digits);
  }
}
