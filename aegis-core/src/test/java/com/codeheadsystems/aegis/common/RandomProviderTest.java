package com.codeheadsystems.aegis.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void defaultConstructor_createsSecureRandom() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.random()).isNotNull();
  }

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsCorrectLength() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).hasSize(0);
    assertThat(rp.randomBytes(16)).hasSize(16);
    assertThat(rp.randomBytes(32)).hasSize(32);
  }

  @Test
  void randomUnsignedByte_isNeverNegative() {
    RandomProvider rp = new RandomProvider(new SequenceRandom(0xFF, 0x80, 0x00));
    assertThat(rp.randomUnsignedByte()).isEqualTo(255);
    assertThat(rp.randomUnsignedByte()).isEqualTo(128);
    assertThat(rp.randomUnsignedByte()).isZero();
  }
}
