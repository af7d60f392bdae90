package com.codeheadsystems.aegis.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Returned once, when enrolment starts. Neither the secret nor the backup codes can be
 * retrieved again.
 *
 * @param secret          base32 one-time-password secret
 * @param provisioningUri {@code otpauth://} URI for QR rendering
 * @param backupCodes     plaintext single-use backup codes
 */
public record SetupResponse(
    @JsonProperty("secret") String secret,
    @JsonProperty("provisioningUri") String provisioningUri,
    @JsonProperty("backupCodes") List<String> backupCodes) {
}
