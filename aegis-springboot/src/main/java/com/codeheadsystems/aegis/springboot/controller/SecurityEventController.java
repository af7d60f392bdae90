package com.codeheadsystems.aegis.springboot.controller;

import com.codeheadsystems.aegis.event.SecurityEvent;
import com.codeheadsystems.aegis.event.SecurityStats;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.springboot.security.AegisPrincipal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Security dashboard. The security filter chain only lets requests with a live session reach it.
 */
@RestController
@RequestMapping("/security")
public class SecurityEventController {

  private static final Logger log = LoggerFactory.getLogger(SecurityEventController.class);

  private final TwoFactorManager manager;

  public SecurityEventController(TwoFactorManager manager) {
    this.manager = manager;
  }

  @GetMapping("/events/{adminId}")
  public List<SecurityEvent> events(@AuthenticationPrincipal AegisPrincipal principal,
                                    @PathVariable("adminId") String adminId,
                                    @RequestParam(name = "limit", defaultValue = "50") int limit) {
    log.trace("events(viewer={}, limit={})", principal.adminId(), limit);
    return manager.events(adminId, limit);
  }

  @GetMapping("/stats")
  public SecurityStats stats() {
    return manager.stats();
  }
}
