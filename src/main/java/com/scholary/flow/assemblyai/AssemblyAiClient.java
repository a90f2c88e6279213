package com.scholary.flow.assemblyai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.flow.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the AssemblyAI v2 REST API.
 *
 * <p>Uses the Java 11+ HttpClient. Uploads are streamed from disk rather than loaded into memory.
 * Every request carries the API key in the {@code authorization} header.
 *
 * <p>Polling runs on the calling thread and sleeps between attempts. Interrupting that thread
 * stops the loop.
 */
@Component
public class AssemblyAiClient implements AssemblyAiService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssemblyAiClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final AssemblyAiProperties properties;
  private final ObjectMapper objectMapper;
  private final Sleeper sleeper;

  @Autowired
  public AssemblyAiClient(AssemblyAiProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, Sleeper.SYSTEM);
  }

  public AssemblyAiClient(
      AssemblyAiProperties properties, ObjectMapper objectMapper, Sleeper sleeper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.sleeper = sleeper;
    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info(
        "Initialized AssemblyAI client: baseUrl={}, pollInterval={}, maxPollAttempts={}",
        properties.baseUrl(),
        properties.pollInterval(),
        properties.maxPollAttempts());
  }

  @Override
  public String upload(Path audioFile) {
    try {
      HttpRequest request =
          authorized(endpoint("/v2/upload"))
              .header("Content-Type", "application/octet-stream")
              .POST(BodyPublishers.ofFile(audioFile))
              .build();

      HttpResponse<String> response = send(request);
      if (!isSuccess(response)) {
        throw new AssemblyAiException(
            AssemblyAiException.Kind.UPLOAD_FAILED, "Failed to upload audio: " + response.body());
      }

      UploadResponse upload = objectMapper.readValue(response.body(), UploadResponse.class);
      if (upload.uploadUrl() == null || upload.uploadUrl().isBlank()) {
        throw new AssemblyAiException(
            AssemblyAiException.Kind.UPLOAD_FAILED,
            "Failed to upload audio: response has no upload_url: " + response.body());
      }
      return upload.uploadUrl();

    } catch (IOException e) {
      throw new AssemblyAiException(
          AssemblyAiException.Kind.UPLOAD_FAILED, "Failed to upload audio: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssemblyAiException(
          AssemblyAiException.Kind.INTERRUPTED, "Audio upload interrupted", e);
    }
  }

  @Override
  public String submit(String uploadUrl) {
    try {
      String body = objectMapper.writeValueAsString(new TranscriptRequest(uploadUrl));
      HttpRequest request =
          authorized(endpoint("/v2/transcript"))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(body))
              .build();

      HttpResponse<String> response = send(request);
      if (!isSuccess(response)) {
        throw new AssemblyAiException(
            AssemblyAiException.Kind.SUBMIT_FAILED,
            "Failed to submit transcription: " + response.body());
      }

      TranscriptResponse transcript =
          objectMapper.readValue(response.body(), TranscriptResponse.class);
      if (transcript.id() == null || transcript.id().isBlank()) {
        throw new AssemblyAiException(
            AssemblyAiException.Kind.SUBMIT_FAILED,
            "Failed to submit transcription: response has no id: " + response.body());
      }
      LOGGER.info("Submitted transcription job: {}", transcript.id());
      return transcript.id();

    } catch (IOException e) {
      throw new AssemblyAiException(
          AssemblyAiException.Kind.SUBMIT_FAILED,
          "Failed to submit transcription: " + e.getMessage(),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssemblyAiException(
          AssemblyAiException.Kind.INTERRUPTED, "Transcription submit interrupted", e);
    }
  }

  /**
   * Poll the job status at a fixed interval.
   *
   * <p>State machine: {@code queued -> processing -> completed | error}, plus a timeout once
   * {@code maxPollAttempts} polls have seen no terminal status. Every non-terminal poll is
   * followed by one sleep, so a timeout takes {@code maxPollAttempts * pollInterval}.
   */
  @Override
  public String pollUntilDone(String jobId) {
    URI statusEndpoint = endpoint("/v2/transcript/" + jobId);
    int maxAttempts = properties.maxPollAttempts();

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      TranscriptResponse transcript = fetchStatus(statusEndpoint);
      TranscriptStatus status = TranscriptStatus.fromValue(transcript.status());
      structuredLogger.logPollStatus(jobId, attempt, maxAttempts, status.value());

      if (status == TranscriptStatus.COMPLETED) {
        return transcript.text() != null ? transcript.text() : "";
      }
      if (status == TranscriptStatus.ERROR) {
        String detail = transcript.error() != null ? transcript.error() : "Unknown error";
        throw new AssemblyAiException(
            AssemblyAiException.Kind.TRANSCRIPTION_FAILED, "Transcription failed: " + detail);
      }

      try {
        sleeper.sleep(properties.pollInterval());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AssemblyAiException(
            AssemblyAiException.Kind.INTERRUPTED, "Transcription polling interrupted", e);
      }
    }

    LOGGER.warn("Transcription job {} not finished after {} polls", jobId, maxAttempts);
    throw new AssemblyAiException(
        AssemblyAiException.Kind.TRANSCRIPTION_TIMEOUT, "Transcription timed out");
  }

  private TranscriptResponse fetchStatus(URI statusEndpoint) {
    try {
      HttpRequest request = authorized(statusEndpoint).GET().build();
      HttpResponse<String> response = send(request);
      if (!isSuccess(response)) {
        throw new AssemblyAiException(
            AssemblyAiException.Kind.POLL_FAILED,
            String.format(
                "Failed to get transcription status (%d): %s",
                response.statusCode(), response.body()));
      }
      return objectMapper.readValue(response.body(), TranscriptResponse.class);

    } catch (IOException e) {
      throw new AssemblyAiException(
          AssemblyAiException.Kind.POLL_FAILED,
          "Failed to get transcription status: " + e.getMessage(),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssemblyAiException(
          AssemblyAiException.Kind.INTERRUPTED, "Transcription polling interrupted", e);
    }
  }

  private HttpRequest.Builder authorized(URI uri) {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(properties.readTimeout());
    if (properties.hasApiKey()) {
      builder.header("authorization", properties.apiKey());
    }
    return builder;
  }

  private URI endpoint(String path) {
    String baseUrl = properties.baseUrl();
    if (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    return URI.create(baseUrl + path);
  }

  private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
    LOGGER.debug("Sending {} {}", request.method(), request.uri());
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private static boolean isSuccess(HttpResponse<?> response) {
    return response.statusCode() >= 200 && response.statusCode() < 300;
  }
}
