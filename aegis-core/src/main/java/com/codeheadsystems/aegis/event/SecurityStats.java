package com.codeheadsystems.aegis.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Aggregate view of the event log.
 *
 * @param recent  totals for the recent period, by default the last 24 hours
 * @param allTime totals for everything still retained
 */
public record SecurityStats(
    @JsonProperty("last24Hours") Recent recent,
    @JsonProperty("allTime") AllTime allTime) {

  /**
   * @param totalEvents     events in the period
   * @param successfulAuth  successful events
   * @param failedAuth      failed events
   * @param successRate     successful events as a percentage, 0 when there are none
   * @param uniqueAddresses distinct client addresses
   * @param uniqueAdmins    distinct accounts
   */
  public record Recent(
      @JsonProperty("totalEvents") int totalEvents,
      @JsonProperty("successfulAuth") int successfulAuth,
      @JsonProperty("failedAuth") int failedAuth,
      @JsonProperty("successRate") double successRate,
      @JsonProperty("uniqueAddresses") int uniqueAddresses,
      @JsonProperty("uniqueAdmins") int uniqueAdmins) {
  }

  /**
   * @param totalEvents events retained
   * @param oldestEvent timestamp of the oldest retained event, null when empty
   */
  public record AllTime(
      @JsonProperty("totalEvents") int totalEvents,
      @JsonProperty("oldestEvent") Instant oldestEvent) {
  }
}
