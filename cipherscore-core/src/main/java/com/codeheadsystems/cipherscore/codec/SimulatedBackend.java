package com.codeheadsystems.cipherscore.codec;

import static com.codeheadsystems.cipherscore.common.ByteUtils.concat;

import com.codeheadsystems.cipherscore.common.ByteUtils;
import com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reversible keyed simulation of a homomorphic scheme. NOT secure: anyone holding the key
 * recovers every plaintext, and the engine arithmetic decrypts internally.
 * <p>
 * Wire format (64 bytes): {@code (x + pad) mod 2^256 || tag} where
 * {@code tag = HMAC-SHA256(key, I2OSP(x, 32))} and {@code pad = HMAC-SHA256(key, "pad" || tag)}.
 * Encryption is deterministic for a given key, which makes opaque results directly comparable
 * in tests.
 */
public class SimulatedBackend implements HomomorphicBackend {

  private static final Logger log = LoggerFactory.getLogger(SimulatedBackend.class);

  /**
   * Width of the value and tag halves.
   */
  public static final int Nv = 32;
  public static final int CIPHERTEXT_LENGTH = 2 * Nv;

  private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(8 * Nv);
  private static final byte[] PAD_LABEL = "pad".getBytes(StandardCharsets.US_ASCII);

  private final byte[] key;

  /**
   * Instantiates a new simulated backend.
   *
   * @param key HMAC key, at least 16 bytes
   */
  public SimulatedBackend(byte[] key) {
    if (key == null || key.length < 16) {
      throw new IllegalArgumentException("Simulation key must be at least 16 bytes");
    }
    this.key = key.clone();
    log.warn("Using SimulatedBackend: ciphertexts are reversible with the configured key. "
        + "Do not use in production.");
  }

  @Override
  public String name() {
    return "simulation";
  }

  @Override
  public int ciphertextLength() {
    return CIPHERTEXT_LENGTH;
  }

  @Override
  public BigInteger plaintextModulus() {
    return MODULUS;
  }

  @Override
  public byte[] encrypt(BigInteger plaintext) {
    BigInteger x = plaintext.mod(MODULUS);
    byte[] tag = hmac(ByteUtils.I2OSP(x, Nv));
    BigInteger masked = x.add(pad(tag)).mod(MODULUS);
    return concat(ByteUtils.I2OSP(masked, Nv), tag);
  }

  @Override
  public BigInteger decrypt(byte[] ciphertext) {
    BigInteger x = unmask(ciphertext);
    byte[] tag = ByteUtils.slice(ciphertext, Nv, Nv);
    if (!Arrays.constantTimeAreEqual(tag, hmac(ByteUtils.I2OSP(x, Nv)))) {
      throw new MalformedCiphertextException("Ciphertext authentication tag mismatch");
    }
    return x;
  }

  @Override
  public byte[] add(byte[] a, byte[] b) {
    return encrypt(decrypt(a).add(decrypt(b)));
  }

  @Override
  public byte[] multiply(byte[] a, BigInteger scalar) {
    return encrypt(decrypt(a).multiply(scalar));
  }

  @Override
  public boolean validate(byte[] ciphertext) {
    if (ciphertext.length != CIPHERTEXT_LENGTH) {
      return false;
    }
    byte[] tag = ByteUtils.slice(ciphertext, Nv, Nv);
    return Arrays.constantTimeAreEqual(tag, hmac(ByteUtils.I2OSP(unmask(ciphertext), Nv)));
  }

  private BigInteger unmask(byte[] ciphertext) {
    BigInteger masked = ByteUtils.OS2IP(ByteUtils.slice(ciphertext, 0, Nv));
    byte[] tag = ByteUtils.slice(ciphertext, Nv, Nv);
    return masked.subtract(pad(tag)).mod(MODULUS);
  }

  private BigInteger pad(byte[] tag) {
    return ByteUtils.OS2IP(hmac(concat(PAD_LABEL, tag)));
  }

  private byte[] hmac(byte[] data) {
    HMac mac = new HMac(new SHA256Digest());
    mac.init(new KeyParameter(key));
    mac.update(data, 0, data.length);
    byte[] out = new byte[mac.getMacSize()];
    mac.doFinal(out, 0);
    return out;
  }
}
