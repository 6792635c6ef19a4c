package com.acme.fabric.web;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ResponseFilter;
import io.micronaut.http.annotation.ServerFilter;
import java.util.UUID;

/**
 * Resolves the correlation id of a fabric request from {@code X-Request-ID}, generating one when
 * the caller sent none, and echoes it on every response including error responses.
 */
@ServerFilter("/v1/**")
public class CorrelationIdFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-ID";
  public static final String CORRELATION_ID_ATTRIBUTE = "fabric.correlationId";

  @RequestFilter
  public void assignCorrelationId(MutableHttpRequest<?> request) {
    String requestId = request.getHeaders().get(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    request.setAttribute(CORRELATION_ID_ATTRIBUTE, requestId);
  }

  @ResponseFilter
  public void echoCorrelationId(HttpRequest<?> request, MutableHttpResponse<?> response) {
    request
        .getAttribute(CORRELATION_ID_ATTRIBUTE, String.class)
        .ifPresent(id -> response.header(REQUEST_ID_HEADER, id));
  }
}
