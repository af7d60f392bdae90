package com.codeheadsystems.aegis.exceptions;

/**
 * Raised when caller input is malformed or out of bounds: oversized plaintext, a badly formed
 * backup code, a missing field. Maps to HTTP 400.
 */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }
}
