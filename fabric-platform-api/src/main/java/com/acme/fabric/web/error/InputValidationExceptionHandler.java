package com.acme.fabric.web.error;

import com.acme.fabric.processor.validation.InputValidationException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Request body failed field validation: 422 with every failing field. */
@Produces
@Singleton
@Requires(classes = {InputValidationException.class, ExceptionHandler.class})
public class InputValidationExceptionHandler
    implements ExceptionHandler<InputValidationException, HttpResponse<ValidationErrorResponse>> {

  @Override
  public HttpResponse<ValidationErrorResponse> handle(
      HttpRequest request, InputValidationException exception) {
    return HttpResponse.<ValidationErrorResponse>status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ValidationErrorResponse(exception.getErrors()));
  }
}
