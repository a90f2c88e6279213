package com.scholary.flow.config;

import com.scholary.flow.assemblyai.AssemblyAiProperties;
import com.scholary.flow.ytdlp.ProcessResult;
import com.scholary.flow.ytdlp.ProcessRunner;
import com.scholary.flow.ytdlp.YtDlpProperties;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reports missing external prerequisites at startup.
 *
 * <p>Only warns: the service still starts, and each request reports the missing tool or key when
 * it needs it.
 */
@Component
@ConditionalOnProperty(name = "flow.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(StartupPreflightChecks.class);

  private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

  private final YtDlpProperties ytDlpProperties;
  private final AssemblyAiProperties assemblyAiProperties;
  private final ProcessRunner processRunner;

  public StartupPreflightChecks(
      YtDlpProperties ytDlpProperties,
      AssemblyAiProperties assemblyAiProperties,
      ProcessRunner processRunner) {
    this.ytDlpProperties = ytDlpProperties;
    this.assemblyAiProperties = assemblyAiProperties;
    this.processRunner = processRunner;
  }

  @Override
  public void run(ApplicationArguments args) {
    checkYtDlp();
    checkApiKey();
  }

  void checkYtDlp() {
    String binary = ytDlpProperties.binary();
    try {
      ProcessResult result = processRunner.run(List.of(binary, "--version"), VERSION_CHECK_TIMEOUT);
      if (result.succeeded()) {
        LOGGER.info("Using {} (version: {})", binary, result.stdout().strip());
      } else {
        LOGGER.warn(
            "{} --version failed (exitCode={}, timedOut={}); downloads will fail",
            binary,
            result.exitCode(),
            result.timedOut());
      }
    } catch (IOException e) {
      LOGGER.warn("{} is not available on PATH; downloads will fail: {}", binary, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while checking {}", binary);
    }
  }

  void checkApiKey() {
    if (!assemblyAiProperties.hasApiKey()) {
      LOGGER.warn("ASSEMBLYAI_API_KEY is not set; transcription requests will fail");
    }
  }
}
