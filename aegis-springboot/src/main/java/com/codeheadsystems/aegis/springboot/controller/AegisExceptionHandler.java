package com.codeheadsystems.aegis.springboot.controller;

import com.codeheadsystems.aegis.exceptions.ErrorTranslator;
import com.codeheadsystems.aegis.exceptions.PublicError;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders every failure escaping a controller through {@link ErrorTranslator}.
 */
@RestControllerAdvice
public class AegisExceptionHandler {

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<PublicError> unreadable(RuntimeException e) {
    return render(new PublicError(400, ErrorTranslator.INVALID_REQUEST));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<PublicError> failure(RuntimeException e) {
    return render(ErrorTranslator.translate(e));
  }

  static ResponseEntity<PublicError> render(PublicError error) {
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(error.status())
        .contentType(MediaType.APPLICATION_JSON);
    if (error.retryAfter() != null) {
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(error.retryAfter()));
    }
    return builder.body(error);
  }
}
