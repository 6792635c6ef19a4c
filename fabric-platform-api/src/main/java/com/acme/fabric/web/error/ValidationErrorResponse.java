package com.acme.fabric.web.error;

import java.util.Map;

/** Field name to first failing rule message, returned with 422. */
public record ValidationErrorResponse(Map<String, String> error) {}
