package com.codeheadsystems.aegis.event;

/**
 * Whether an account may start another second-factor setup.
 *
 * @param allowed true if setup may proceed
 * @param reason  why not, when denied
 */
public record SetupDecision(boolean allowed, String reason) {

  public static final SetupDecision ALLOWED = new SetupDecision(true, null);
}
