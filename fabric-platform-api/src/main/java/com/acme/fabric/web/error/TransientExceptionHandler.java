package com.acme.fabric.web.error;

import com.acme.fabric.core.TransientException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

@Produces
@Singleton
@Requires(classes = {TransientException.class, ExceptionHandler.class})
public class TransientExceptionHandler
    implements ExceptionHandler<TransientException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, TransientException exception) {
    return ServerErrorResponses.internalError(request, exception);
  }
}
