package com.codeheadsystems.cipherscore.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.cipherscore.auth.AuthorizationGate;
import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.manager.CreditProfileManager;
import com.codeheadsystems.cipherscore.server.manager.LendingPoolManager;
import com.codeheadsystems.cipherscore.server.manager.ScoringManager;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "cipherscore.backend=PAILLIER",
    "cipherscore.paillier-key-bits=512",
    "cipherscore.key-seed-hex=00112233445566778899aabbccddeeff",
    "cipherscore.owner-identity=0xDeployer"
})
class CipherScoreIntegrationTest {

  private static final Identity OWNER = Identity.of("0xdeployer");
  private static final Identity ALICE = Identity.of("0xalice");
  private static final Identity LENDER = Identity.of("0xlender");

  @Autowired private OpaqueValueCodec codec;
  @Autowired private AuthorizationGate gate;
  @Autowired private CreditProfileManager profiles;
  @Autowired private ScoringManager scoring;
  @Autowired private LendingPoolManager pools;

  @Test
  void submitScoreAndMatch_endToEnd() {
    gate.grant(OWNER, LENDER, Capability.POOL_REGISTRATION);
    int strict = pools.addPool(LENDER, codec.encrypt(200_000_000), codec.encrypt(1_000_000_000), 450, "Strict");
    int lenient = pools.addPool(LENDER, codec.encrypt(100_000_000), codec.encrypt(1_000_000_000), 500, "Lenient");

    profiles.submitPlaintext(ALICE, 50_000, 100_000, 20_000, 85, 30);
    OpaqueValue score = scoring.computeScore(ALICE);

    assertThat(codec.decrypt(score)).isEqualTo(BigInteger.valueOf(165_357_500L));
    assertThat(pools.findMatches(score)).containsExactly(lenient).doesNotContain(strict);
    assertThat(pools.optimalLoanAmount(score, lenient)).isEqualTo(pools.getPool(lenient).maxLoan());
  }
}
