package com.codeheadsystems.cipherscore.codec;

import com.codeheadsystems.cipherscore.common.ByteUtils;
import com.codeheadsystems.cipherscore.common.RandomProvider;
import com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paillier cryptosystem with {@code g = n + 1}.
 * <p>
 * Addition and scalar multiplication are evaluated on ciphertexts without the private key:
 * {@code E(a) * E(b) = E(a + b)} and {@code E(a)^k = E(a * k)} modulo {@code n^2}.
 * Results of both operations are re-randomized so a product with zero does not reveal itself.
 * Comparison is not homomorphic in Paillier; {@link #compare} decrypts inside this backend
 * and returns only the ordering.
 * <p>
 * Ciphertexts are serialized as fixed-length big-endian integers of {@code 2 * keyBits / 8} bytes.
 */
public class PaillierBackend implements HomomorphicBackend {

  private static final Logger log = LoggerFactory.getLogger(PaillierBackend.class);

  /**
   * Smallest accepted modulus size. Keeps the plaintext space well above the codec's 256-bit width.
   */
  public static final int MIN_KEY_BITS = 512;

  private final BigInteger n;
  private final BigInteger nSquared;
  private final BigInteger lambda;
  private final BigInteger mu;
  private final int ciphertextLength;
  private final RandomProvider randomProvider;

  private PaillierBackend(BigInteger p, BigInteger q, int keyBits, RandomProvider randomProvider) {
    this.n = p.multiply(q);
    this.nSquared = n.multiply(n);
    BigInteger pMinus = p.subtract(BigInteger.ONE);
    BigInteger qMinus = q.subtract(BigInteger.ONE);
    this.lambda = pMinus.multiply(qMinus).divide(pMinus.gcd(qMinus));
    // With g = n + 1, L(g^lambda mod n^2) = lambda mod n.
    this.mu = lambda.modInverse(n);
    this.ciphertextLength = 2 * keyBits / 8;
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh key pair.
   *
   * @param keyBits        modulus size in bits, a multiple of 16 and at least {@link #MIN_KEY_BITS}
   * @param randomProvider source of key and encryption randomness
   * @return the backend
   */
  public static PaillierBackend generate(int keyBits, RandomProvider randomProvider) {
    return generate(keyBits, randomProvider, randomProvider);
  }

  /**
   * Generates a key pair from one random source and encrypts with another. A seeded
   * {@code keyRandom} reproduces the same key across restarts while encryption noise stays fresh.
   *
   * @param keyBits     modulus size in bits, a multiple of 16 and at least {@link #MIN_KEY_BITS}
   * @param keyRandom   source of the primes
   * @param noiseRandom source of encryption randomness
   * @return the backend
   */
  public static PaillierBackend generate(int keyBits, RandomProvider keyRandom, RandomProvider noiseRandom) {
    if (keyBits < MIN_KEY_BITS || keyBits % 16 != 0) {
      throw new IllegalArgumentException("Paillier key size must be a multiple of 16 and at least "
          + MIN_KEY_BITS + " bits: " + keyBits);
    }
    while (true) {
      BigInteger p = BigInteger.probablePrime(keyBits / 2, keyRandom.random());
      BigInteger q = BigInteger.probablePrime(keyBits / 2, keyRandom.random());
      if (p.equals(q)) {
        continue;
      }
      BigInteger n = p.multiply(q);
      BigInteger phi = p.subtract(BigInteger.ONE).multiply(q.subtract(BigInteger.ONE));
      if (n.bitLength() == keyBits && n.gcd(phi).equals(BigInteger.ONE)) {
        log.debug("Generated {}-bit Paillier key", keyBits);
        return new PaillierBackend(p, q, keyBits, noiseRandom);
      }
    }
  }

  /**
   * Rebuilds a backend from persisted primes.
   *
   * @param p              first prime
   * @param q              second prime
   * @param randomProvider source of encryption randomness
   * @return the backend
   */
  public static PaillierBackend fromPrimes(BigInteger p, BigInteger q, RandomProvider randomProvider) {
    int keyBits = p.multiply(q).bitLength();
    if (keyBits < MIN_KEY_BITS || keyBits % 16 != 0 || p.equals(q)) {
      throw new IllegalArgumentException("Primes do not form a valid " + keyBits + "-bit Paillier modulus");
    }
    return new PaillierBackend(p, q, keyBits, randomProvider);
  }

  @Override
  public String name() {
    return "paillier-" + n.bitLength();
  }

  @Override
  public int ciphertextLength() {
    return ciphertextLength;
  }

  @Override
  public BigInteger plaintextModulus() {
    return n;
  }

  /**
   * The public modulus; sufficient for client-side encryption.
   */
  public BigInteger publicModulus() {
    return n;
  }

  @Override
  public byte[] encrypt(BigInteger plaintext) {
    BigInteger m = plaintext.mod(n);
    // (1 + n)^m = 1 + m*n (mod n^2)
    BigInteger gm = BigInteger.ONE.add(m.multiply(n)).mod(nSquared);
    return serialize(gm.multiply(noise()).mod(nSquared));
  }

  @Override
  public BigInteger decrypt(byte[] ciphertext) {
    BigInteger c = deserialize(ciphertext);
    BigInteger u = c.modPow(lambda, nSquared);
    BigInteger l = u.subtract(BigInteger.ONE).divide(n);
    return l.multiply(mu).mod(n);
  }

  @Override
  public byte[] add(byte[] a, byte[] b) {
    BigInteger sum = deserialize(a).multiply(deserialize(b)).mod(nSquared);
    return serialize(sum.multiply(noise()).mod(nSquared));
  }

  @Override
  public byte[] multiply(byte[] a, BigInteger scalar) {
    BigInteger product = deserialize(a).modPow(scalar, nSquared);
    return serialize(product.multiply(noise()).mod(nSquared));
  }

  @Override
  public boolean validate(byte[] ciphertext) {
    if (ciphertext.length != ciphertextLength) {
      return false;
    }
    BigInteger c = ByteUtils.OS2IP(ciphertext);
    return c.signum() > 0 && c.compareTo(nSquared) < 0 && c.gcd(n).equals(BigInteger.ONE);
  }

  // r^n mod n^2 for a random unit r.
  private BigInteger noise() {
    BigInteger r;
    do {
      r = new BigInteger(n.bitLength(), randomProvider.random());
    } while (r.signum() == 0 || r.compareTo(n) >= 0 || !r.gcd(n).equals(BigInteger.ONE));
    return r.modPow(n, nSquared);
  }

  private byte[] serialize(BigInteger c) {
    return ByteUtils.I2OSP(c, ciphertextLength);
  }

  private BigInteger deserialize(byte[] ciphertext) {
    if (!validate(ciphertext)) {
      throw new MalformedCiphertextException("Not a valid Paillier ciphertext for this key");
    }
    return ByteUtils.OS2IP(ciphertext);
  }
}
