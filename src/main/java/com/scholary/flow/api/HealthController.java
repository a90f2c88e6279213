package com.scholary.flow.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness endpoints. */
@RestController
@Tag(name = "Health", description = "Liveness checks")
public class HealthController {

  static final String ROOT_MESSAGE = "Flow Backend is running!";

  private final String serviceName;

  public HealthController(@Value("${spring.application.name}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(summary = "Root", description = "Plain-text check that the server is up")
  public String index() {
    return ROOT_MESSAGE;
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check")
  public HealthResponse health() {
    return new HealthResponse("healthy", serviceName);
  }
}
