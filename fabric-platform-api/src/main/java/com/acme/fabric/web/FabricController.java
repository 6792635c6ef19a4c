package com.acme.fabric.web;

import com.acme.fabric.command.CommandContext;
import com.acme.fabric.domain.Fabric;
import com.acme.fabric.processor.service.FabricCommandService;
import com.acme.fabric.processor.validation.FabricInputValidator;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Put;
import io.micronaut.http.annotation.RequestAttribute;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;

/**
 * REST ingress for fabric commands. Input is validated here so every failing field is reported at
 * once; rule violations raised further down are mapped by the handlers in {@code web.error}.
 */
@Controller("/v1/fabrics")
@ExecuteOn(TaskExecutors.BLOCKING)
@RequiredArgsConstructor
public class FabricController {

  public static final String USER_ID_HEADER = "X-User-ID";
  public static final String CORRELATION_ID_MDC_KEY = "correlationId";

  private final FabricCommandService commandService;

  @Post
  public HttpResponse<Void> create(
      @Body FabricRequests.Create request,
      @RequestAttribute(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE) String correlationId,
      @Nullable @Header(USER_ID_HEADER) String userId) {
    return withCorrelation(
        correlationId,
        () -> {
          FabricInputValidator.validateCreate(request.code(), request.name()).throwIfInvalid();
          commandService.createFabric(
              CommandContext.rest(correlationId, userId),
              request.code(),
              request.name(),
              request.measureUnit(),
              request.offerStatus());
          return HttpResponse.accepted();
        });
  }

  @Put("/{code}")
  public HttpResponse<Map<String, FabricView>> update(
      @PathVariable String code,
      @Body FabricRequests.Update request,
      @RequestAttribute(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE) String correlationId,
      @Nullable @Header(USER_ID_HEADER) String userId) {
    return withCorrelation(
        correlationId,
        () -> {
          FabricInputValidator.validateUpdate(request.version(), request.name()).throwIfInvalid();
          Fabric fabric =
              commandService.updateFabric(
                  CommandContext.rest(correlationId, userId),
                  code,
                  request.name(),
                  request.measureUnit(),
                  request.offerStatus(),
                  request.version());
          return HttpResponse.ok(Map.of("fabric", FabricView.of(fabric)));
        });
  }

  @Delete("/{code}")
  public HttpResponse<Void> delete(
      @PathVariable String code,
      @Body FabricRequests.Delete request,
      @RequestAttribute(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE) String correlationId,
      @Nullable @Header(USER_ID_HEADER) String userId) {
    return withCorrelation(
        correlationId,
        () -> {
          FabricInputValidator.validateDelete(request.version()).throwIfInvalid();
          commandService.deleteFabric(
              CommandContext.rest(correlationId, userId), code, request.version());
          return HttpResponse.noContent();
        });
  }

  @Get("/{code}")
  public Map<String, FabricView> get(@PathVariable String code) {
    return Map.of("fabric", FabricView.of(commandService.getByCode(code)));
  }

  /** Event history of a fabric, oldest first. Still available after the fabric is deleted. */
  @Get("/{code}/events")
  public Map<String, List<EventView>> events(@PathVariable String code) {
    List<EventView> events =
        commandService.getHistory(code).stream().map(EventView::of).toList();
    return Map.of("events", events);
  }

  private static <T> T withCorrelation(String correlationId, Supplier<T> action) {
    MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
    try {
      return action.get();
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
