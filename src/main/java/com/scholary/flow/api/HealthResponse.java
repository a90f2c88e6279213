package com.scholary.flow.api;

/** Body of {@code GET /api/health}. */
public record HealthResponse(String status, String service) {}
