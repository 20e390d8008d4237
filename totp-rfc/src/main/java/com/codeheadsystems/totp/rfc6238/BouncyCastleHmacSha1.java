package com.codeheadsystems.totp.rfc6238;

import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HMAC-SHA1 backed by the BouncyCastle lightweight API.
 * A new {@link HMac} is created per call, so one instance may be shared freely.
 */
public class BouncyCastleHmacSha1 implements HmacSha1 {

  @Override
  public byte[] hmacSha1(final byte[] key, final byte[] message) {
    HMac hmac = new HMac(new SHA1Digest());
    hmac.init(new KeyParameter(key));
    hmac.update(message, 0, message.length);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }
}
