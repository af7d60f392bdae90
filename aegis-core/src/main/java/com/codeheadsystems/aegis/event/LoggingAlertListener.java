package com.codeheadsystems.aegis.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener: logs each alert at WARN with the account id shortened to eight characters.
 */
public class LoggingAlertListener implements SecurityAlertListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingAlertListener.class);
  private static final int ID_PREFIX = 8;

  @Override
  public void onAlert(SecurityAlert alert) {
    String id = alert.adminId();
    String shortId = id.length() > ID_PREFIX ? id.substring(0, ID_PREFIX) + "..." : id;
    log.warn("SECURITY ALERT: {} failed second-factor attempts within {} for admin {} from {}",
        alert.failureCount(), alert.window(), shortId, alert.clientAddress());
  }
}
