package com.codeheadsystems.totp.rfc6238;

import com.codeheadsystems.totp.common.ByteUtils;
import com.codeheadsystems.totp.rfc4648.Base32Codec;
import com.codeheadsystems.totp.rfc4648.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-based one-time passwords per RFC 6238, HMAC-SHA1 profile.
 * <p>
 * The code for a time {@code T} is HOTP(K, floor(T / step)) from RFC 4226: the counter is
 * serialized as 8 bytes big-endian, signed with HMAC-SHA1 under the decoded secret, and the
 * digest is reduced by dynamic truncation (RFC 4226 section 5.3) to {@code digits} decimal
 * digits.
 * <p>
 * Every method is a pure function of its arguments; instances hold no mutable state.
 */
public class TotpGenerator {

  /**
   * Largest {@code window} accepted by {@link #verify}, in steps on each side.
   */
  public static final int MAX_WINDOW = 10;

  private static final Logger log = LoggerFactory.getLogger(TotpGenerator.class);

  private static final int COUNTER_LENGTH = 8;
  private static final int[] POWERS_OF_TEN = {
      1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000, 1_000_000_000
  };

  private final HmacSha1 hmac;
  private final Base32Codec codec;

  /**
   * Instantiates a new Totp generator using BouncyCastle HMAC-SHA1 and the standard alphabet.
   */
  public TotpGenerator() {
    this(new BouncyCastleHmacSha1(), Base32Codec.standard());
  }

  /**
   * Instantiates a new Totp generator.
   *
   * @param hmac  the HMAC-SHA1 primitive
   * @param codec the codec used to decode secrets
   */
  public TotpGenerator(final HmacSha1 hmac, final Base32Codec codec) {
    this.hmac = Objects.requireNonNull(hmac, "hmac");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Generates the code for {@link TotpConfig#DEFAULT}.
   *
   * @param secretBase32    the base32 secret, case-insensitive
   * @param unixTimeSeconds seconds since the epoch
   * @return the code
   */
  public String generate(final String secretBase32, final long unixTimeSeconds) {
    return generate(secretBase32, unixTimeSeconds, TotpConfig.DEFAULT);
  }

  /**
   * Generates the code for {@link TotpConfig#DEFAULT} at the given instant.
   *
   * @param secretBase32 the base32 secret, case-insensitive
   * @param instant      the instant, truncated to whole seconds
   * @return the code
   */
  public String generate(final String secretBase32, final Instant instant) {
    return generate(secretBase32, instant.getEpochSecond());
  }

  /**
   * Generates the code for the given configuration.
   *
   * @param secretBase32    the base32 secret, case-insensitive
   * @param unixTimeSeconds seconds since the epoch
   * @param config          the step and digit count
   * @return the code
   */
  public String generate(final String secretBase32, final long unixTimeSeconds, final TotpConfig config) {
    return generate(secretBase32, unixTimeSeconds, config.stepSeconds(), config.digits());
  }

  /**
   * Generates a TOTP code.
   *
   * @param secretBase32    the base32 secret, case-insensitive; whitespace and separators are ignored
   * @param unixTimeSeconds seconds since the epoch, not negative
   * @param stepSeconds     the time step, at least 1
   * @param digits          the code length, 1 to 9
   * @return the code, zero-padded to exactly {@code digits} characters
   * @throws InvalidSecretException if the secret does not decode or decodes to nothing
   * @throws TotpDigestException    if the HMAC primitive fails
   */
  public String generate(final String secretBase32, final long unixTimeSeconds,
                         final int stepSeconds, final int digits) {
    checkArguments(unixTimeSeconds, stepSeconds, digits);
    final byte[] key = decodeSecret(secretBase32);
    return codeFor(key, timeStep(unixTimeSeconds, stepSeconds), digits);
  }

  /**
   * Generates a TOTP code from an already-decoded key.
   *
   * @param key             the raw key bytes
   * @param unixTimeSeconds seconds since the epoch, not negative
   * @param stepSeconds     the time step, at least 1
   * @param digits          the code length, 1 to 9
   * @return the code
   * @throws InvalidSecretException if the key is empty
   */
  public String generateFromKey(final byte[] key, final long unixTimeSeconds,
                                final int stepSeconds, final int digits) {
    Objects.requireNonNull(key, "key");
    checkArguments(unixTimeSeconds, stepSeconds, digits);
    if (key.length == 0) {
      throw new InvalidSecretException("Secret key is empty");
    }
    return codeFor(key, timeStep(unixTimeSeconds, stepSeconds), digits);
  }

  /**
   * Checks a submitted code against the time steps within {@code window} steps of the given time.
   *
   * @param secretBase32    the base32 secret
   * @param code            the submitted code, may be null
   * @param unixTimeSeconds seconds since the epoch
   * @param config          the step and digit count
   * @param window          number of adjacent steps accepted on each side, 0 to {@link #MAX_WINDOW}
   * @return true if the code matches one of the accepted steps
   * @throws IllegalArgumentException if {@code window} is negative or above {@link #MAX_WINDOW}
   */
  public boolean verify(final String secretBase32, final String code, final long unixTimeSeconds,
                        final TotpConfig config, final int window) {
    if (window < 0 || window > MAX_WINDOW) {
      throw new IllegalArgumentException("window must be between 0 and " + MAX_WINDOW + ": " + window);
    }
    checkArguments(unixTimeSeconds, config.stepSeconds(), config.digits());
    final byte[] key = decodeSecret(secretBase32);
    if (code == null || code.length() != config.digits()) {
      return false;
    }
    final byte[] submitted = code.getBytes(StandardCharsets.US_ASCII);
    final long current = timeStep(unixTimeSeconds, config.stepSeconds());
    boolean matched = false;
    for (long delta = -window; delta <= window; delta++) {
      if ((delta < 0 && current + delta < 0) || (delta > 0 && current > Long.MAX_VALUE - delta)) {
        continue;
      }
      final byte[] expected = codeFor(key, current + delta, config.digits()).getBytes(StandardCharsets.US_ASCII);
      matched |= MessageDigest.isEqual(expected, submitted);
    }
    return matched;
  }

  /**
   * The time-step counter, {@code floor(unixTimeSeconds / stepSeconds)}.
   *
   * @param unixTimeSeconds the unix time seconds
   * @param stepSeconds     the step seconds
   * @return the long
   */
  public static long timeStep(final long unixTimeSeconds, final int stepSeconds) {
    return unixTimeSeconds / stepSeconds;
  }

  /**
   * Seconds until the code for {@code unixTimeSeconds} changes, 1 to {@code stepSeconds}.
   *
   * @param unixTimeSeconds the unix time seconds
   * @param stepSeconds     the step seconds
   * @return the int
   */
  public static int secondsRemaining(final long unixTimeSeconds, final int stepSeconds) {
    checkArguments(unixTimeSeconds, stepSeconds, TotpConfig.DEFAULT_DIGITS);
    return (int) (stepSeconds - (unixTimeSeconds % stepSeconds));
  }

  /**
   * Dynamic truncation from RFC 4226 section 5.3, rendered as a zero-padded decimal string.
   *
   * @param digest the 20-byte HMAC-SHA1 digest
   * @param digits the code length
   * @return the code
   */
  static String truncate(final byte[] digest, final int digits) {
    final int offset = digest[digest.length - 1] & 0x0F;
    final int binary = ByteUtils.readInt(digest, offset) & 0x7FFFFFFF;
    final int code = binary % POWERS_OF_TEN[digits];
    final StringBuilder result = new StringBuilder(digits);
    final String value = Integer.toString(code);
    for (int i = value.length(); i < digits; i++) {
      result.append('0');
    }
    return result.append(value).toString();
  }

  private String codeFor(final byte[] key, final long counter, final int digits) {
    log.trace("codeFor(counter={}, digits={})", counter, digits);
    final byte[] message = ByteUtils.I2OSP(counter, COUNTER_LENGTH);
    final byte[] digest;
    try {
      digest = hmac.hmacSha1(key, message);
    } catch (RuntimeException e) {
      throw new TotpDigestException("HMAC-SHA1 failed", e);
    }
    if (digest == null || digest.length != HmacSha1.DIGEST_LENGTH) {
      throw new TotpDigestException("HMAC-SHA1 returned "
          + (digest == null ? "no digest" : digest.length + " bytes") + ", expected " + HmacSha1.DIGEST_LENGTH);
    }
    return truncate(digest, digits);
  }

  private byte[] decodeSecret(final String secretBase32) {
    Objects.requireNonNull(secretBase32, "secretBase32");
    final byte[] key;
    try {
      key = codec.decode(secretBase32.toUpperCase(Locale.ROOT));
    } catch (MalformedInputException e) {
      throw new InvalidSecretException("Secret is not valid base32: " + e.getMessage(), e);
    }
    if (key.length == 0) {
      throw new InvalidSecretException("Secret decodes to an empty key");
    }
    return key;
  }

  private static void checkArguments(final long unixTimeSeconds, final int stepSeconds, final int digits) {
    if (unixTimeSeconds < 0) {
      throw new IllegalArgumentException("unixTimeSeconds must not be negative: " + unixTimeSeconds);
    }
    if (stepSeconds < 1) {
      throw new IllegalArgumentException("stepSeconds must be positive: " + stepSeconds);
    }
    if (digits < 1 || digits > TotpConfig.MAX_DIGITS) {
      throw new IllegalArgumentException("digits must be between 1 and " + TotpConfig.MAX_DIGITS + ": " + digits);
    }
  }
}
