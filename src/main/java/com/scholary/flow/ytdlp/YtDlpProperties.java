package com.scholary.flow.ytdlp;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the yt-dlp audio retriever.
 *
 * <p>The binary is resolved from {@code PATH} unless an absolute path is configured. Timeouts cap
 * how long a single request may block on the subprocess.
 */
@ConfigurationProperties(prefix = "ytdlp")
@Validated
public record YtDlpProperties(
    @NotBlank String binary,
    @NotNull Duration titleTimeout,
    @NotNull Duration downloadTimeout,
    @NotBlank String audioFormat,
    @NotBlank String tempDir,
    @NotBlank String fallbackTitle,
    @Valid @NotNull TitleCacheProperties titleCache) {

  public record TitleCacheProperties(@Positive int maxSize, @NotNull Duration ttl) {}
}
