package com.codeheadsystems.aegis.field;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UploadValidatorTest {

  private final UploadValidator validator = new UploadValidator();

  @Test
  void validImage_passes() {
    UploadValidation result = validator.validate("front.jpg", "image/jpeg", 2_000_000);

    assertThat(result.valid()).isTrue();
    assertThat(result.category()).isEqualTo("image");
    assertThat(result.errors()).isEmpty();
  }

  @Test
  void document_isCategorized() {
    assertThat(validator.validate("deed.pdf", "application/pdf", 10).category()).isEqualTo("document");
  }

  @Test
  void oversized_fails() {
    UploadValidation result = validator.validate("big.png", "image/png", UploadValidator.DEFAULT_MAX_BYTES + 1);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0)).contains("10MB");
  }

  @Test
  void disallowedType_fails() {
    UploadValidation result = validator.validate("archive.zip", "application/zip", 100);

    assertThat(result.valid()).isFalse();
    assertThat(result.category()).isEqualTo("other");
  }

  @Test
  void scriptExtension_failsEvenWithAllowedType() {
    UploadValidation result = validator.validate("invoice.pdf.exe", "application/pdf", 100);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).anyMatch(e -> e.contains("suspicious"));
  }

  @Test
  void longName_fails() {
    UploadValidation result = validator.validate("a".repeat(252) + ".png", "image/png", 100);

    assertThat(result.valid()).isFalse();
    assertThat(result.suggestedActions()).contains("Please rename the file with a shorter name");
  }
}
