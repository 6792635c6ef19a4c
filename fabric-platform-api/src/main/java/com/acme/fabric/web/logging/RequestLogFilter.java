package com.acme.fabric.web.logging;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ResponseFilter;
import io.micronaut.http.annotation.ServerFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes one access log line per completed HTTP request. */
@ServerFilter(ServerFilter.MATCH_ALL_PATTERN)
public class RequestLogFilter {

  static final String STARTED_AT_ATTRIBUTE = "fabric.requestStartedAt";

  private static final Logger LOG = LoggerFactory.getLogger(RequestLogFilter.class);

  @RequestFilter
  public void markStart(HttpRequest<?> request) {
    request.setAttribute(STARTED_AT_ATTRIBUTE, System.nanoTime());
  }

  @ResponseFilter
  public void logCompletion(HttpRequest<?> request, MutableHttpResponse<?> response) {
    long elapsedMs =
        request
            .getAttribute(STARTED_AT_ATTRIBUTE, Long.class)
            .map(start -> (System.nanoTime() - start) / 1_000_000)
            .orElse(-1L);
    int status = response.getStatus().getCode();
    if (status >= 500) {
      LOG.warn("{} {} -> {} in {}ms", request.getMethod(), request.getPath(), status, elapsedMs);
    } else {
      LOG.info("{} {} -> {} in {}ms", request.getMethod(), request.getPath(), status, elapsedMs);
    }
  }
}
