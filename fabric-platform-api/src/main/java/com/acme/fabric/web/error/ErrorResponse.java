package com.acme.fabric.web.error;

/** Body of every error response that carries a single message. */
public record ErrorResponse(String error) {}
