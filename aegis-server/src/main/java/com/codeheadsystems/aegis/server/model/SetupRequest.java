package com.codeheadsystems.aegis.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Starts second-factor enrolment.
 *
 * @param adminId     the administrator account
 * @param accountName label shown in the authenticator app; defaults to the admin id
 */
public record SetupRequest(
    @JsonProperty("adminId") String adminId,
    @JsonProperty("accountName") String accountName) {
}
