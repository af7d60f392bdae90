package com.codeheadsystems.aegis.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.aegis.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

class SecurityValidatorTest {

  @Test
  void isValidTotpCode() {
    assertThat(SecurityValidator.isValidTotpCode("012345")).isTrue();
    assertThat(SecurityValidator.isValidTotpCode("12345")).isFalse();
    assertThat(SecurityValidator.isValidTotpCode("1234567")).isFalse();
    assertThat(SecurityValidator.isValidTotpCode("12a456")).isFalse();
    assertThat(SecurityValidator.isValidTotpCode(null)).isFalse();
  }

  @Test
  void isValidSessionToken() {
    assertThat(SecurityValidator.isValidSessionToken("a".repeat(64))).isTrue();
    assertThat(SecurityValidator.isValidSessionToken("A".repeat(64))).isFalse();
    assertThat(SecurityValidator.isValidSessionToken("a".repeat(63))).isFalse();
  }

  @Test
  void normalizeBackupCode_stripsWhitespaceAndUppercases() {
    assertThat(SecurityValidator.normalizeBackupCode(" ab12 cd34\t")).hasValue("AB12CD34");
    assertThat(SecurityValidator.normalizeBackupCode("AB12CD3")).isEmpty();
    assertThat(SecurityValidator.normalizeBackupCode("AB12-CD3")).isEmpty();
    assertThat(SecurityValidator.normalizeBackupCode(null)).isEmpty();
  }

  @Test
  void requireBackupCode_malformed_throws() {
    assertThatThrownBy(() -> SecurityValidator.requireBackupCode("nope"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void requireNonBlank_namesField() {
    assertThatThrownBy(() -> SecurityValidator.requireNonBlank(" ", "adminId"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("adminId");
    assertThat(SecurityValidator.requireNonBlank("x", "adminId")).isEqualTo("x");
  }
}
