package com.codeheadsystems.totp.rfc6238;

/**
 * Thrown when a shared secret cannot be decoded or decodes to an empty key.
 */
public class InvalidSecretException extends RuntimeException {

  /**
   * Instantiates a new Invalid secret exception.
   *
   * @param message the message
   */
  public InvalidSecretException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid secret exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidSecretException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
