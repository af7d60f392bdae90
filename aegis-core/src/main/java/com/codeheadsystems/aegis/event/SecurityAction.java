package com.codeheadsystems.aegis.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Second-factor operations recorded by {@link SecurityEventTracker}.
 */
public enum SecurityAction {
  SETUP("setup"),
  VERIFY("verify"),
  BACKUP_USED("backup-used"),
  DISABLED("disabled");

  private final String wireName;

  SecurityAction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static SecurityAction fromWireName(String wireName) {
    for (SecurityAction action : values()) {
      if (action.wireName.equals(wireName)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown security action: " + wireName);
  }
}
