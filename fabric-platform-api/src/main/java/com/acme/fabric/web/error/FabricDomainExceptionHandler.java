package com.acme.fabric.web.error;

import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.domain.DuplicateFabricCodeException;
import com.acme.fabric.domain.FabricDomainException;
import com.acme.fabric.domain.FabricNotFoundException;
import com.acme.fabric.domain.FabricValidationException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps fabric rule violations to HTTP statuses:
 *
 * <ul>
 *   <li>not found: 404
 *   <li>validation: 422 with the failing field
 *   <li>duplicate code, version conflict, already deleted: 409
 * </ul>
 */
@Slf4j
@Produces
@Singleton
@Requires(classes = {FabricDomainException.class, ExceptionHandler.class})
public class FabricDomainExceptionHandler
    implements ExceptionHandler<FabricDomainException, HttpResponse<?>> {

  static final String NOT_FOUND_MESSAGE = "the requested resource could not be found";
  static final String DUPLICATE_MESSAGE = "a fabric with this code already exists";
  static final String CONFLICT_MESSAGE =
      "the resource has been modified by another process, please refresh and try again";

  @Override
  public HttpResponse<?> handle(HttpRequest request, FabricDomainException exception) {
    log.debug("{} {} rejected: {}", request.getMethod(), request.getPath(), exception.getMessage());

    if (exception instanceof FabricNotFoundException) {
      return HttpResponse.notFound(new ErrorResponse(NOT_FOUND_MESSAGE));
    }
    if (exception instanceof FabricValidationException validation) {
      return HttpResponse.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(
              new ValidationErrorResponse(
                  Map.of(validation.getRule().getField(), validation.getMessage())));
    }
    if (exception instanceof DuplicateFabricCodeException) {
      return conflict(DUPLICATE_MESSAGE);
    }
    if (exception instanceof ConcurrencyConflictException) {
      return conflict(CONFLICT_MESSAGE);
    }
    // already deleted
    return conflict(exception.getMessage());
  }

  private static HttpResponse<ErrorResponse> conflict(String message) {
    return HttpResponse.status(HttpStatus.CONFLICT).body(new ErrorResponse(message));
  }
}
