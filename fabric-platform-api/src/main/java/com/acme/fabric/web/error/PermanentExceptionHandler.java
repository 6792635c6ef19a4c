package com.acme.fabric.web.error;

import com.acme.fabric.core.PermanentException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Non-retryable infrastructure failure, e.g. a schema or data error. Domain and input rule
 * violations are also {@link PermanentException}s but have their own handlers.
 */
@Produces
@Singleton
@Requires(classes = {PermanentException.class, ExceptionHandler.class})
public class PermanentExceptionHandler
    implements ExceptionHandler<PermanentException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, PermanentException exception) {
    return ServerErrorResponses.internalError(request, exception);
  }
}
