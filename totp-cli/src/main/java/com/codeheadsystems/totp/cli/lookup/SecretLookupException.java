package com.codeheadsystems.totp.cli.lookup;

/**
 * Thrown when the secrets store itself cannot be read.
 */
public class SecretLookupException extends RuntimeException {

  /**
   * Instantiates a new Secret lookup exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SecretLookupException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
