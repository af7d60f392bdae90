package com.codeheadsystems.aegis.exceptions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sanitized error safe to return to a client.
 *
 * @param status     HTTP status code
 * @param error      generic error message
 * @param retryAfter seconds until a retry may succeed, only set for 429 responses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicError(
    @JsonIgnore int status,
    @JsonProperty("error") String error,
    @JsonProperty("retryAfter") Long retryAfter) {

  public PublicError(int status, String error) {
    this(status, error, null);
  }
}
