package com.codeheadsystems.aegis.exceptions;

/**
 * Raised when the subsystem cannot start with the supplied configuration, for example when a
 * master passphrase is missing or too short. Fatal at startup.
 */
public class ConfigurationException extends IllegalStateException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
