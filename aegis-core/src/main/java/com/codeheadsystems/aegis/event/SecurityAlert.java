package com.codeheadsystems.aegis.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Raised when one account sees too many failures from one address within the window.
 *
 * @param adminId       the targeted account
 * @param clientAddress the address the failures came from
 * @param failureCount  failures counted in the window
 * @param window        the window length
 * @param detectedAt    when the threshold was reached
 */
public record SecurityAlert(String adminId, String clientAddress, int failureCount,
                            Duration window, Instant detectedAt) {
}
