package com.codeheadsystems.cipherscore.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherscore.common.ByteUtils;
import com.codeheadsystems.cipherscore.common.RandomProvider;
import com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * The type Paillier backend test. Uses a small seeded key so key generation stays fast.
 */
class PaillierBackendTest {

  private static final byte[] SEED = "paillier-backend-test".getBytes(StandardCharsets.US_ASCII);

  private static PaillierBackend backend;

  @BeforeAll
  static void generateKey() {
    backend = PaillierBackend.generate(PaillierBackend.MIN_KEY_BITS, RandomProvider.seeded(SEED));
  }

  @Test
  void generate_producesRequestedModulusSize() {
    assertThat(backend.publicModulus().bitLength()).isEqualTo(PaillierBackend.MIN_KEY_BITS);
    assertThat(backend.ciphertextLength()).isEqualTo(2 * PaillierBackend.MIN_KEY_BITS / 8);
    assertThat(backend.name()).isEqualTo("paillier-512");
  }

  @Test
  void generate_rejectsSmallOrUnalignedKeys() {
    assertThatThrownBy(() -> PaillierBackend.generate(256, new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PaillierBackend.generate(520, new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void generate_sameSeedSameKey() {
    PaillierBackend again = PaillierBackend.generate(PaillierBackend.MIN_KEY_BITS, RandomProvider.seeded(SEED));

    assertThat(again.publicModulus()).isEqualTo(backend.publicModulus());
  }

  @Test
  void encrypt_isRandomized() {
    byte[] first = backend.encrypt(BigInteger.ONE);
    byte[] second = backend.encrypt(BigInteger.ONE);

    assertThat(first).isNotEqualTo(second);
    assertThat(backend.decrypt(first)).isEqualTo(backend.decrypt(second)).isEqualTo(BigInteger.ONE);
  }

  @Test
  void add_decryptsToSum() {
    byte[] sum = backend.add(backend.encrypt(BigInteger.valueOf(85)), backend.encrypt(BigInteger.valueOf(50_000)));

    assertThat(backend.decrypt(sum)).isEqualTo(BigInteger.valueOf(50_085));
  }

  @Test
  void multiply_decryptsToProduct() {
    byte[] product = backend.multiply(backend.encrypt(BigInteger.valueOf(85)), BigInteger.valueOf(35));

    assertThat(backend.decrypt(product)).isEqualTo(BigInteger.valueOf(2975));
  }

  @Test
  void multiplyByZero_isRerandomized() {
    byte[] zero = backend.multiply(backend.encrypt(BigInteger.valueOf(9)), BigInteger.ZERO);

    assertThat(ByteUtils.OS2IP(zero)).isNotEqualTo(BigInteger.ONE);
    assertThat(backend.decrypt(zero)).isZero();
  }

  @Test
  void compare_ordersByPlaintext() {
    byte[] small = backend.encrypt(BigInteger.valueOf(600));
    byte[] large = backend.encrypt(BigInteger.valueOf(800));

    assertThat(backend.compare(small, large)).isNegative();
    assertThat(backend.compare(large, small)).isPositive();
    assertThat(backend.compare(small, backend.encrypt(BigInteger.valueOf(600)))).isZero();
  }

  @Test
  void validate_rejectsOutOfGroupValues() {
    assertThat(backend.validate(new byte[backend.ciphertextLength()])).isFalse();
    BigInteger n = backend.publicModulus();
    assertThat(backend.validate(ByteUtils.I2OSP(n, backend.ciphertextLength()))).isFalse();
    assertThat(backend.validate(new byte[backend.ciphertextLength() + 1])).isFalse();
  }

  @Test
  void decrypt_foreignCiphertext_throws() {
    byte[] zeros = new byte[backend.ciphertextLength()];

    assertThatThrownBy(() -> backend.decrypt(zeros)).isInstanceOf(MalformedCiphertextException.class);
  }

  @Test
  void fromPrimes_rebuildsWorkingKey() {
    RandomProvider random = RandomProvider.seeded(SEED);
    BigInteger p;
    BigInteger q;
    do {
      p = BigInteger.probablePrime(256, random.random());
      q = BigInteger.probablePrime(256, random.random());
    } while (p.equals(q) || p.multiply(q).bitLength() != 512);

    PaillierBackend rebuilt = PaillierBackend.fromPrimes(p, q, new RandomProvider());

    assertThat(rebuilt.publicModulus()).isEqualTo(p.multiply(q));
    assertThat(rebuilt.decrypt(rebuilt.encrypt(BigInteger.valueOf(31337)))).isEqualTo(BigInteger.valueOf(31337));
  }

  @Test
  void fromPrimes_rejectsEqualPrimes() {
    BigInteger p = BigInteger.probablePrime(256, RandomProvider.seeded(SEED).random());

    assertThatThrownBy(() -> PaillierBackend.fromPrimes(p, p, new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
