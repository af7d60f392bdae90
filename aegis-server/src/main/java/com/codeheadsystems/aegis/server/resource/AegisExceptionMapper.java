package com.codeheadsystems.aegis.server.resource;

import com.codeheadsystems.aegis.exceptions.ErrorTranslator;
import com.codeheadsystems.aegis.exceptions.PublicError;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Turns every exception escaping a resource into a sanitized JSON error via
 * {@link ErrorTranslator}. {@link WebApplicationException}s keep their status and headers but
 * lose any entity they carry.
 */
@Provider
public class AegisExceptionMapper implements ExceptionMapper<RuntimeException> {

  @Override
  public Response toResponse(final RuntimeException exception) {
    if (exception instanceof WebApplicationException wae) {
      // Keep headers such as WWW-Authenticate; replace the entity.
      int status = wae.getResponse().getStatus();
      return Response.fromResponse(wae.getResponse())
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(new PublicError(status, messageFor(status)))
          .build();
    }
    PublicError error = ErrorTranslator.translate(exception);
    Response.ResponseBuilder builder = Response.status(error.status())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(error);
    if (error.retryAfter() != null) {
      builder.header(HttpHeaders.RETRY_AFTER, error.retryAfter());
    }
    return builder.build();
  }

  private static String messageFor(final int status) {
    if (status == Response.Status.BAD_REQUEST.getStatusCode()) {
      return ErrorTranslator.INVALID_REQUEST;
    }
    Response.Status known = Response.Status.fromStatusCode(status);
    if (known == null || known.getFamily() != Response.Status.Family.CLIENT_ERROR) {
      return ErrorTranslator.INTERNAL_ERROR;
    }
    return known.getReasonPhrase();
  }
}
