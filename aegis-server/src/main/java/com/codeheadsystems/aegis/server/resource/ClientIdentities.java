package com.codeheadsystems.aegis.server.resource;

import com.codeheadsystems.aegis.ratelimit.ClientIdentity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Builds a {@link ClientIdentity} from the servlet request: remote address plus User-Agent.
 */
public final class ClientIdentities {

  private ClientIdentities() {
  }

  public static ClientIdentity from(HttpServletRequest request) {
    if (request == null) {
      return new ClientIdentity(null, null);
    }
    return new ClientIdentity(request.getRemoteAddr(), request.getHeader("User-Agent"));
  }
}
