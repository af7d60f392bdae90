package com.codeheadsystems.aegis.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An account plus a six-digit one-time password or a backup code.
 *
 * @param adminId the administrator account
 * @param code    the submitted code
 */
public record CodeRequest(
    @JsonProperty("adminId") String adminId,
    @JsonProperty("code") String code) {
}
