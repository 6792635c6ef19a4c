package com.acme.fabric.web;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;

/** Liveness endpoint for container orchestration and load balancers. */
@Controller
public class HealthController {

  @Get(uris = {"/", "/health"})
  @Produces(MediaType.APPLICATION_JSON)
  public HttpResponse<String> health() {
    return HttpResponse.ok("{\"status\":\"UP\"}");
  }
}
