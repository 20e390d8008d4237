package com.codeheadsystems.totp.cli.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.totp.cli.lookup.SecretLookup;
import com.codeheadsystems.totp.cli.lookup.SecretNotFoundException;
import com.codeheadsystems.totp.cli.model.TotpResult;
import com.codeheadsystems.totp.rfc6238.InvalidSecretException;
import com.codeheadsystems.totp.rfc6238.TotpConfig;
import com.codeheadsystems.totp.rfc6238.TotpGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TotpManagerTest {

  private static final String ACCOUNT = "github";
  private static final String SECRET = "JBSWY3DPEHPK3PXP";

  @Mock private SecretLookup secretLookup;

  private static Clock clockAt(long epochSeconds) {
    return Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
  }

  @Test
  void totpFor_usesLookupAndClock() {
    when(secretLookup.lookupSecret(ACCOUNT)).thenReturn(SECRET);
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator(), TotpConfig.DEFAULT,
        clockAt(1_700_000_000L));

    TotpResult result = manager.totpFor(ACCOUNT);

    assertThat(result.accountId()).isEqualTo(ACCOUNT);
    assertThat(result.code()).isEqualTo("324550");
    assertThat(result.secondsRemaining()).isEqualTo(10);
    verify(secretLookup).lookupSecret(ACCOUNT);
  }

  @Test
  void totpFor_honoursConfig() {
    when(secretLookup.lookupSecret(ACCOUNT)).thenReturn(SECRET);
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator(), new TotpConfig(60, 6),
        clockAt(1_700_000_000L));

    TotpResult result = manager.totpFor(ACCOUNT);

    assertThat(result.code()).isEqualTo("508648");
    assertThat(result.secondsRemaining()).isEqualTo(40);
  }

  @Test
  void totpFor_eightDigits() {
    when(secretLookup.lookupSecret(ACCOUNT)).thenReturn(SECRET);
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator(), TotpConfig.DEFAULT.withDigits(8),
        clockAt(1_700_000_000L));

    assertThat(manager.totpFor(ACCOUNT).code()).isEqualTo("02324550");
  }

  @Test
  void totpFor_notFoundPropagatesUnchanged() {
    SecretNotFoundException notFound = new SecretNotFoundException(ACCOUNT);
    when(secretLookup.lookupSecret(ACCOUNT)).thenThrow(notFound);
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator());

    assertThatThrownBy(() -> manager.totpFor(ACCOUNT)).isSameAs(notFound);
  }

  @Test
  void totpFor_invalidSecretPropagates() {
    when(secretLookup.lookupSecret(ACCOUNT)).thenReturn("not base32!");
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator(), TotpConfig.DEFAULT, clockAt(59));

    assertThatThrownBy(() -> manager.totpFor(ACCOUNT)).isInstanceOf(InvalidSecretException.class);
  }

  @Test
  void totpFor_productionConstructorUsesSystemClock() {
    when(secretLookup.lookupSecret(ACCOUNT)).thenReturn(SECRET);
    TotpManager manager = new TotpManager(secretLookup, new TotpGenerator());

    TotpResult result = manager.totpFor(ACCOUNT);

    assertThat(result.code()).hasSize(6).containsOnlyDigits();
    assertThat(result.secondsRemaining()).isBetween(1, 30);
  }
}
