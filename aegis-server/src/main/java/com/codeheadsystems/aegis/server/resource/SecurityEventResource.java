package com.codeheadsystems.aegis.server.resource;

import com.codeheadsystems.aegis.event.SecurityEvent;
import com.codeheadsystems.aegis.event.SecurityStats;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only security dashboard endpoints. Both require a live administrator session.
 */
@Singleton
@Path("/security")
@Produces(MediaType.APPLICATION_JSON)
public class SecurityEventResource {

  private static final Logger log = LoggerFactory.getLogger(SecurityEventResource.class);

  private final TwoFactorManager manager;

  @Inject
  public SecurityEventResource(final TwoFactorManager manager) {
    this.manager = manager;
    log.info("SecurityEventResource({})", manager);
  }

  /**
   * Most recent events for one administrator, newest first.
   */
  @GET
  @Path("/events/{adminId}")
  public List<SecurityEvent> events(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                                    @PathParam("adminId") final String adminId,
                                    @QueryParam("limit") @DefaultValue("50") final int limit) {
    manager.requireSession(authorization);
    log.trace("events(limit={})", limit);
    return manager.events(adminId, limit);
  }

  @GET
  @Path("/stats")
  public SecurityStats stats(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization) {
    manager.requireSession(authorization);
    return manager.stats();
  }
}
