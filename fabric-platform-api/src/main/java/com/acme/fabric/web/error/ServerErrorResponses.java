package com.acme.fabric.web.error;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Shared 500 response for infrastructure failures. The cause is logged, never returned. */
final class ServerErrorResponses {

  static final String MESSAGE =
      "the server encountered a problem and could not process your request";

  private static final Logger LOG = LoggerFactory.getLogger(ServerErrorResponses.class);

  private ServerErrorResponses() {}

  static HttpResponse<ErrorResponse> internalError(HttpRequest<?> request, RuntimeException e) {
    LOG.error("{} {} failed", request.getMethod(), request.getPath(), e);
    return HttpResponse.<ErrorResponse>status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse(MESSAGE));
  }
}
