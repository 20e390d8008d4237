package com.codeheadsystems.totp.rfc6238;

/**
 * Keyed HMAC-SHA1 primitive used by {@link TotpGenerator}.
 */
@FunctionalInterface
public interface HmacSha1 {

  /**
   * Length of an HMAC-SHA1 digest in bytes.
   */
  int DIGEST_LENGTH = 20;

  /**
   * Computes HMAC-SHA1(key, message).
   *
   * @param key     the key
   * @param message the message
   * @return a new 20-byte digest
   */
  byte[] hmacSha1(byte[] key, byte[] message);
}
