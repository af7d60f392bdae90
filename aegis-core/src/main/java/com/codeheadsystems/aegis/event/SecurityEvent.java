package com.codeheadsystems.aegis.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One recorded second-factor operation.
 *
 * @param adminId         the administrator account
 * @param clientAddress   caller network address
 * @param clientSignature caller signature, typically the User-Agent
 * @param action          what was attempted
 * @param success         whether it succeeded
 * @param timestamp       when it happened
 */
public record SecurityEvent(
    @JsonProperty("adminId") String adminId,
    @JsonProperty("clientAddress") String clientAddress,
    @JsonProperty("clientSignature") String clientSignature,
    @JsonProperty("action") SecurityAction action,
    @JsonProperty("success") boolean success,
    @JsonProperty("timestamp") Instant timestamp) {
}
