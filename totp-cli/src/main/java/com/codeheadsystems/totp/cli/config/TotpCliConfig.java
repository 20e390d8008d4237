package com.codeheadsystems.totp.cli.config;

import com.codeheadsystems.totp.rfc6238.TotpConfig;
import java.nio.file.Path;
import java.util.Map;

/**
 * Parsed command-line options.
 * <p>
 * Exactly one of {@code account} and {@code secret} is set. {@code time} is null when the
 * system clock should be used.
 *
 * @param account     the account to look up, or null
 * @param secret      an inline base32 secret, or null
 * @param secretsFile the properties file holding account secrets
 * @param time        fixed epoch seconds, or null
 * @param totpConfig  the step and digit count
 */
public record TotpCliConfig(String account, String secret, Path secretsFile, Long time, TotpConfig totpConfig) {

  /**
   * Environment variable overriding the default secrets file.
   */
  public static final String SECRETS_FILE_ENV = "TOTP_SECRETS_FILE";

  /**
   * Default secrets file, relative to the user's home directory.
   */
  public static final String DEFAULT_SECRETS_FILE = ".totp/secrets.properties";

  /**
   * Parses the arguments with the current environment and home directory.
   *
   * @param args the args
   * @return the totp cli config
   */
  public static TotpCliConfig fromArgs(final String[] args) {
    return fromArgs(args, System.getenv(), System.getProperty("user.home"));
  }

  /**
   * Parses the arguments.
   *
   * @param args     the args
   * @param env      the environment
   * @param userHome the user home directory
   * @return the totp cli config
   * @throws IllegalArgumentException on a usage error
   */
  public static TotpCliConfig fromArgs(final String[] args, final Map<String, String> env, final String userHome) {
    String account = null;
    String secret = null;
    String secretsFile = env.get(SECRETS_FILE_ENV);
    Long time = null;
    int digits = TotpConfig.DEFAULT_DIGITS;
    int step = TotpConfig.DEFAULT_STEP_SECONDS;

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--secret" -> secret = value(args, ++i, "--secret");
        case "--secrets" -> secretsFile = value(args, ++i, "--secrets");
        case "--time" -> time = number(value(args, ++i, "--time"), "--time");
        case "--digits" -> digits = intNumber(value(args, ++i, "--digits"), "--digits");
        case "--step" -> step = intNumber(value(args, ++i, "--step"), "--step");
        default -> {
          if (args[i].startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + args[i]);
          }
          if (account != null) {
            throw new IllegalArgumentException("Only one account may be given");
          }
          account = args[i];
        }
      }
    }

    if ((account == null) == (secret == null)) {
      throw new IllegalArgumentException("Give either an account or --secret");
    }
    if (time != null && time < 0) {
      throw new IllegalArgumentException("--time must not be negative");
    }
    final Path path = (secretsFile == null || secretsFile.isBlank())
        ? Path.of(userHome, DEFAULT_SECRETS_FILE)
        : Path.of(secretsFile);
    return new TotpCliConfig(account, secret, path, time, new TotpConfig(step, digits));
  }

  private static String value(final String[] args, final int i, final String option) {
    if (i >= args.length) {
      throw new IllegalArgumentException(option + " needs a value");
    }
    return args[i];
  }

  private static Long number(final String value, final String option) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(option + " needs a number: " + value, e);
    }
  }

  private static int intNumber(final String value, final String option) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(option + " needs a number: " + value, e);
    }
  }
}
