package com.codeheadsystems.aegis.validation;

import com.codeheadsystems.aegis.exceptions.ValidationException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Format checks for authentication inputs. These run before any hashing or cipher work so that
 * malformed input is rejected cheaply.
 */
public class SecurityValidator {

  private static final Pattern TOTP_CODE = Pattern.compile("^[0-9]{6}$");
  private static final Pattern BACKUP_CODE = Pattern.compile("^[A-Z0-9]{8}$");
  private static final Pattern SESSION_TOKEN = Pattern.compile("^[a-f0-9]{64}$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private SecurityValidator() {
  }

  public static boolean isValidTotpCode(String code) {
    return code != null && TOTP_CODE.matcher(code).matches();
  }

  public static boolean isValidSessionToken(String token) {
    return token != null && SESSION_TOKEN.matcher(token).matches();
  }

  /**
   * Strips whitespace and upper-cases a backup code as typed by a user.
   *
   * @param code the raw code
   * @return the canonical code, or empty if it is not eight characters of {@code [A-Z0-9]}
   */
  public static Optional<String> normalizeBackupCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    String normalized = WHITESPACE.matcher(code).replaceAll("").toUpperCase(Locale.ROOT);
    return BACKUP_CODE.matcher(normalized).matches() ? Optional.of(normalized) : Optional.empty();
  }

  /**
   * Same as {@link #normalizeBackupCode(String)} but throws on bad input.
   *
   * @throws ValidationException if the code is malformed
   */
  public static String requireBackupCode(String code) {
    return normalizeBackupCode(code)
        .orElseThrow(() -> new ValidationException("Invalid backup code format"));
  }

  /**
   * @throws ValidationException if the value is null or blank
   */
  public static String requireNonBlank(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Missing required field: " + field);
    }
    return value;
  }
}
