package com.codeheadsystems.aegis.ratelimit;

/**
 * How a caller is identified for rate limiting and event tracking.
 *
 * @param address   network address of the caller
 * @param signature client signature, typically the User-Agent header
 */
public record ClientIdentity(String address, String signature) {

  public static final String UNKNOWN = "unknown";

  public ClientIdentity {
    address = address == null || address.isBlank() ? UNKNOWN : address;
    signature = signature == null || signature.isBlank() ? UNKNOWN : signature;
  }

  /**
   * Counter key, {@code address:signature}.
   */
  public String key() {
    return address + ":" + signature;
  }
}
