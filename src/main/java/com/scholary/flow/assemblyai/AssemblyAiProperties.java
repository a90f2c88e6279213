package com.scholary.flow.assemblyai;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the AssemblyAI client.
 *
 * <p>The API key is not validated here so the service can start without one; requests then fail
 * at upload with the provider's authorization error.
 */
@ConfigurationProperties(prefix = "assemblyai")
@Validated
public record AssemblyAiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotNull Duration pollInterval,
    @Positive int maxPollAttempts) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
