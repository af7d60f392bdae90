package com.codeheadsystems.aegis.server.resource;

import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.server.model.CodeRequest;
import com.codeheadsystems.aegis.server.model.SessionResponse;
import com.codeheadsystems.aegis.server.model.SetupRequest;
import com.codeheadsystems.aegis.server.model.SetupResponse;
import com.codeheadsystems.aegis.server.model.StatusResponse;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for administrator second-factor enrolment and login.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /2fa/setup}: start enrolment, returns secret and backup codes once</li>
 *   <li>{@code POST /2fa/confirm}: enable with the first code</li>
 *   <li>{@code POST /2fa/verify}: one-time password login</li>
 *   <li>{@code POST /2fa/backup}: backup code login</li>
 *   <li>{@code POST /2fa/disable}: turn the second factor off</li>
 * </ul>
 * Manager exceptions propagate to {@link AegisExceptionMapper}.
 */
@Singleton
@Path("/2fa")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TwoFactorResource {

  private static final Logger log = LoggerFactory.getLogger(TwoFactorResource.class);

  private final TwoFactorManager manager;

  @Context
  private HttpServletRequest servletRequest;

  @Inject
  public TwoFactorResource(final TwoFactorManager manager) {
    this.manager = manager;
    log.info("TwoFactorResource({})", manager);
  }

  TwoFactorResource(final TwoFactorManager manager, final HttpServletRequest servletRequest) {
    this(manager);
    this.servletRequest = servletRequest;
  }

  @POST
  @Path("/setup")
  public SetupResponse setup(final SetupRequest request) {
    requireBody(request);
    return manager.beginSetup(request.adminId(), request.accountName(), ClientIdentities.from(servletRequest));
  }

  @POST
  @Path("/confirm")
  public StatusResponse confirm(final CodeRequest request) {
    requireBody(request);
    return manager.confirmSetup(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @POST
  @Path("/verify")
  public SessionResponse verify(final CodeRequest request) {
    requireBody(request);
    return manager.verify(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @POST
  @Path("/backup")
  public SessionResponse backup(final CodeRequest request) {
    requireBody(request);
    return manager.verifyBackupCode(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  @POST
  @Path("/disable")
  public StatusResponse disable(final CodeRequest request) {
    requireBody(request);
    return manager.disable(request.adminId(), request.code(), ClientIdentities.from(servletRequest));
  }

  private static void requireBody(final Object request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
  }
}
