package com.codeheadsystems.aegis.springboot.controller;

import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.server.model.CodeRequest;
import com.codeheadsystems.aegis.server.model.SessionResponse;
import com.codeheadsystems.aegis.server.model.SetupRequest;
import com.codeheadsystems.aegis.server.model.SetupResponse;
import com.codeheadsystems.aegis.server.model.StatusResponse;
import com.codeheadsystems.aegis.server.resource.ClientIdentities;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Second-factor enrolment and login. Failures propagate to {@link AegisExceptionHandler}.
 */
@RestController
@RequestMapping("/2fa")
public class TwoFactorController {

  private static final Logger log = LoggerFactory.getLogger(TwoFactorController.class);

  private final TwoFactorManager manager;

  public TwoFactorController(TwoFactorManager manager) {
    this.manager = manager;
    log.info("TwoFactorController({})", manager);
  }

  @PostMapping("/setup")
  public SetupResponse setup(@RequestBody SetupRequest request, HttpServletRequest servletRequest) {
    return manager.beginSetup(request.adminId(), request.accountName(), ClientIdentities.from(servletRequest));
  }

  @PostMapping("/confirm")
  public StatusResponse confirm(@RequestBody CodeRequest request, HttpServletRequest servletRequest) {
    return manager.confirmSetup(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @PostMapping("/verify")
  public SessionResponse verify(@RequestBody CodeRequest request, HttpServletRequest servletRequest) {
    return manager.verify(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @PostMapping("/backup")
  public SessionResponse backup(@RequestBody CodeRequest request, HttpServletRequest servletRequest) {
    return manager.verifyBackupCode(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @PostMapping("/disable")
  public StatusResponse disable(@RequestBody CodeRequest request, HttpServletRequest servletRequest) {
    return manager.disable(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }
}
