package com.codeheadsystems.cipherscore.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

/**
 * The type Identity test.
 */
class IdentityTest {

  // Public key of the well-known private key 0x...01 (the secp256k1 generator point).
  private static final String GENERATOR_XY =
      "79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798"
          + "483ada7726a3c4655da4fbfc0e1108a8fd17b448a68554199c47d08ffb10d4b8";

  @Test
  void normalisesCaseAndWhitespace() {
    assertThat(Identity.of("  0xAbCdEf ")).isEqualTo(Identity.of("0xabcdef"));
    assertThat(Identity.of("0xABC").value()).isEqualTo("0xabc");
  }

  @Test
  void blank_isRejected() {
    assertThatThrownBy(() -> Identity.of(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Identity(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void ordersByValue() {
    assertThat(Identity.of("alice")).isLessThan(Identity.of("bob"));
  }

  @Test
  void fromPublicKey_derivesEthereumStyleAddress() {
    Identity identity = Identity.fromPublicKey(Hex.decode(GENERATOR_XY));

    assertThat(identity.value()).isEqualTo("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf");
  }

  @Test
  void fromPublicKey_acceptsSec1Prefix() {
    byte[] prefixed = Hex.decode("04" + GENERATOR_XY);

    assertThat(Identity.fromPublicKey(prefixed)).isEqualTo(Identity.fromPublicKey(Hex.decode(GENERATOR_XY)));
  }

  @Test
  void fromPublicKey_rejectsCompressedKey() {
    assertThatThrownBy(() -> Identity.fromPublicKey(new byte[33]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
