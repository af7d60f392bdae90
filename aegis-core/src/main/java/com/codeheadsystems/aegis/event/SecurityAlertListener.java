package com.codeheadsystems.aegis.event;

/**
 * Receives alerts raised by {@link SecurityEventTracker}. Called on the recording thread;
 * implementations should not block.
 */
@FunctionalInterface
public interface SecurityAlertListener {

  void onAlert(SecurityAlert alert);
}
