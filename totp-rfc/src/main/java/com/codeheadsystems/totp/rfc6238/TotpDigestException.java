package com.codeheadsystems.totp.rfc6238;

/**
 * Thrown when the HMAC-SHA1 collaborator fails or returns a digest of the wrong size.
 */
public class TotpDigestException extends RuntimeException {

  /**
   * Instantiates a new Totp digest exception.
   *
   * @param message the message
   */
  public TotpDigestException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Totp digest exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TotpDigestException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
