package com.acme.fabric.web.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.fabric.core.PermanentException;
import com.acme.fabric.core.TransientException;
import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.domain.DuplicateFabricCodeException;
import com.acme.fabric.domain.FabricAlreadyDeletedException;
import com.acme.fabric.domain.FabricNotFoundException;
import com.acme.fabric.domain.FabricValidationException;
import com.acme.fabric.processor.validation.InputValidationException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.sql.SQLException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Exception handler mapping")
class ExceptionHandlersTest {

  private final HttpRequest<?> request = HttpRequest.PUT("/v1/fabrics/FAB1", "{}");

  @Nested
  @DisplayName("Domain exceptions")
  class DomainTests {

    private final FabricDomainExceptionHandler handler = new FabricDomainExceptionHandler();

    @Test
    @DisplayName("Not found maps to 404")
    void testNotFound() {
      HttpResponse<?> response = handler.handle(request, new FabricNotFoundException("FAB1"));

      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.body())
          .isEqualTo(new ErrorResponse(FabricDomainExceptionHandler.NOT_FOUND_MESSAGE));
    }

    @Test
    @DisplayName("Aggregate validation maps to 422 keyed by field")
    void testValidation() {
      HttpResponse<?> response =
          handler.handle(
              request, new FabricValidationException(FabricValidationException.Rule.NAME_LENGTH));

      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.body())
          .isEqualTo(
              new ValidationErrorResponse(Map.of("name", "the fabric name length must be 1-250")));
    }

    @Test
    @DisplayName("Duplicate code maps to 409")
    void testDuplicate() {
      HttpResponse<?> response = handler.handle(request, new DuplicateFabricCodeException("FAB1"));

      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.body())
          .isEqualTo(new ErrorResponse(FabricDomainExceptionHandler.DUPLICATE_MESSAGE));
    }

    @Test
    @DisplayName("Version conflict maps to 409 with a refresh hint")
    void testConflict() {
      HttpResponse<?> response =
          handler.handle(request, ConcurrencyConflictException.versionMismatch("FAB1", 1, 2));

      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.body())
          .isEqualTo(new ErrorResponse(FabricDomainExceptionHandler.CONFLICT_MESSAGE));
    }

    @Test
    @DisplayName("Already deleted maps to 409")
    void testAlreadyDeleted() {
      HttpResponse<?> response =
          handler.handle(request, new FabricAlreadyDeletedException("FAB1"));

      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.body())
          .isEqualTo(new ErrorResponse("cannot perform on a deleted fabric: FAB1"));
    }
  }

  @Test
  @DisplayName("Input validation maps to 422 with every failing field")
  void testInputValidation() {
    Map<String, String> errors =
        Map.of("code", "code must be provided", "name", "name must be provided");

    HttpResponse<ValidationErrorResponse> response =
        new InputValidationExceptionHandler().handle(request, new InputValidationException(errors));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.body().error()).isEqualTo(errors);
  }

  @Test
  @DisplayName("Infrastructure failures map to 500 without leaking the cause")
  void testInfrastructure() {
    HttpResponse<ErrorResponse> permanent =
        new PermanentExceptionHandler()
            .handle(
                request,
                new PermanentException("Failed to update fabric", new SQLException("boom")));
    HttpResponse<ErrorResponse> transientFailure =
        new TransientExceptionHandler()
            .handle(request, new TransientException("Failed to publish to Kafka topic app.fabric"));

    assertThat((Object) permanent.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat((Object) transientFailure.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(permanent.body()).isEqualTo(new ErrorResponse(ServerErrorResponses.MESSAGE));
    assertThat(transientFailure.body()).isEqualTo(permanent.body());
  }
}
