package com.codeheadsystems.aegis.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Enrolment state after confirm or disable.
 *
 * @param adminId the administrator account
 * @param enabled whether the second factor is now required
 */
public record StatusResponse(
    @JsonProperty("adminId") String adminId,
    @JsonProperty("enabled") boolean enabled) {
}
