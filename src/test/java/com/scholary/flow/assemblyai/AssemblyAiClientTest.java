package com.scholary.flow.assemblyai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests the client against an in-process stub of the AssemblyAI REST API.
 *
 * <p>Sleeps are recorded instead of performed, so the poll loop runs at full speed.
 */
class AssemblyAiClientTest {

  private static final String API_KEY = "test-key";
  private static final String JOB_ID = "job-1";

  @TempDir Path tempDir;

  private HttpServer server;
  private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
  private final Deque<String> pollResponses = new ConcurrentLinkedDeque<>();
  private final List<Duration> sleeps = new ArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void upload_shouldStreamFileWithAuthorization() throws IOException {
    stub("/v2/upload", 200, "{\"upload_url\":\"https://cdn.assemblyai.com/upload/abc\"}");
    byte[] audio = {1, 2, 3, 4, 5, 6, 7, 8};
    Path file = Files.write(tempDir.resolve("yt_audio.mp3"), audio);

    String uploadUrl = client(API_KEY).upload(file);

    assertThat(uploadUrl).isEqualTo("https://cdn.assemblyai.com/upload/abc");
    RecordedRequest request = requests.get(0);
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.authorization()).isEqualTo(API_KEY);
    assertThat(request.body()).isEqualTo(audio);
  }

  @Test
  void upload_shouldCarryProviderBodyOnFailure() throws IOException {
    stub("/v2/upload", 401, "{\"error\":\"Invalid API key\"}");
    Path file = Files.write(tempDir.resolve("yt_audio.mp3"), new byte[] {1});

    assertThatThrownBy(() -> client(API_KEY).upload(file))
        .isInstanceOf(AssemblyAiException.class)
        .hasMessage("Failed to upload audio: {\"error\":\"Invalid API key\"}")
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.UPLOAD_FAILED);
  }

  @Test
  void upload_shouldOmitAuthorizationWhenNoKeyIsConfigured() throws IOException {
    stub("/v2/upload", 200, "{\"upload_url\":\"https://cdn.assemblyai.com/upload/abc\"}");
    Path file = Files.write(tempDir.resolve("yt_audio.mp3"), new byte[] {1});

    client(null).upload(file);

    assertThat(requests.get(0).authorization()).isNull();
  }

  @Test
  void upload_shouldFailWhenFileIsMissing() {
    assertThatThrownBy(() -> client(API_KEY).upload(tempDir.resolve("missing.mp3")))
        .isInstanceOf(AssemblyAiException.class)
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.UPLOAD_FAILED);
  }

  @Test
  void submit_shouldPostAudioUrlAndReturnJobId() {
    stub("/v2/transcript", 200, "{\"id\":\"job-1\",\"status\":\"queued\"}");

    String jobId = client(API_KEY).submit("https://cdn.assemblyai.com/upload/abc");

    assertThat(jobId).isEqualTo(JOB_ID);
    RecordedRequest request = requests.get(0);
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.contentType()).startsWith("application/json");
    assertThat(request.bodyText())
        .isEqualTo("{\"audio_url\":\"https://cdn.assemblyai.com/upload/abc\"}");
  }

  @Test
  void submit_shouldCarryProviderBodyOnFailure() {
    stub("/v2/transcript", 400, "{\"error\":\"audio_url is required\"}");

    assertThatThrownBy(() -> client(API_KEY).submit("https://cdn.assemblyai.com/upload/abc"))
        .isInstanceOf(AssemblyAiException.class)
        .hasMessage("Failed to submit transcription: {\"error\":\"audio_url is required\"}")
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.SUBMIT_FAILED);
  }

  @Test
  void pollUntilDone_shouldReturnTextAfterThreePolls() {
    stubPolling(
        "{\"id\":\"job-1\",\"status\":\"queued\"}",
        "{\"id\":\"job-1\",\"status\":\"processing\"}",
        "{\"id\":\"job-1\",\"status\":\"completed\",\"text\":\"hello world\"}");

    String text = client(API_KEY).pollUntilDone(JOB_ID);

    assertThat(text).isEqualTo("hello world");
    assertThat(requests).hasSize(3);
    assertThat(requests).allSatisfy(r -> assertThat(r.method()).isEqualTo("GET"));
    assertThat(requests).allSatisfy(r -> assertThat(r.authorization()).isEqualTo(API_KEY));
    assertThat(sleeps).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(3));
  }

  @Test
  void pollUntilDone_shouldStopAtFirstError() {
    stubPolling(
        "{\"id\":\"job-1\",\"status\":\"error\",\"error\":\"Audio duration is too short.\"}",
        "{\"id\":\"job-1\",\"status\":\"completed\",\"text\":\"never reached\"}");

    assertThatThrownBy(() -> client(API_KEY).pollUntilDone(JOB_ID))
        .isInstanceOf(AssemblyAiException.class)
        .hasMessage("Transcription failed: Audio duration is too short.")
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.TRANSCRIPTION_FAILED);

    assertThat(requests).hasSize(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void pollUntilDone_shouldReportUnknownErrorWithoutDetail() {
    stubPolling("{\"id\":\"job-1\",\"status\":\"error\"}");

    assertThatThrownBy(() -> client(API_KEY).pollUntilDone(JOB_ID))
        .hasMessage("Transcription failed: Unknown error");
  }

  @Test
  void pollUntilDone_shouldTimeOutAfterAllAttempts() {
    stubPolling("{\"id\":\"job-1\",\"status\":\"processing\"}");

    assertThatThrownBy(() -> client(API_KEY).pollUntilDone(JOB_ID))
        .isInstanceOf(AssemblyAiException.class)
        .hasMessage("Transcription timed out")
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.TRANSCRIPTION_TIMEOUT);

    assertThat(requests).hasSize(120);
    assertThat(sleeps).hasSize(120);
    Duration totalWait = sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    assertThat(totalWait).isEqualTo(Duration.ofMinutes(6));
  }

  @Test
  void pollUntilDone_shouldKeepPollingOnUnknownStatus() {
    stubPolling(
        "{\"id\":\"job-1\",\"status\":\"rescheduled\"}",
        "{\"id\":\"job-1\",\"status\":\"completed\",\"text\":\"done\"}");

    assertThat(client(API_KEY).pollUntilDone(JOB_ID)).isEqualTo("done");
    assertThat(requests).hasSize(2);
  }

  @Test
  void pollUntilDone_shouldReturnEmptyTextWhenProviderSendsNone() {
    stubPolling("{\"id\":\"job-1\",\"status\":\"completed\",\"text\":null}");

    assertThat(client(API_KEY).pollUntilDone(JOB_ID)).isEmpty();
  }

  @Test
  void pollUntilDone_shouldFailOnErrorResponse() {
    stub("/v2/transcript/" + JOB_ID, 404, "{\"error\":\"Transcript not found\"}");

    assertThatThrownBy(() -> client(API_KEY).pollUntilDone(JOB_ID))
        .isInstanceOf(AssemblyAiException.class)
        .hasMessageContaining("Transcript not found")
        .extracting("kind")
        .isEqualTo(AssemblyAiException.Kind.POLL_FAILED);
  }

  @Test
  void pollUntilDone_shouldStopWhenInterrupted() {
    stubPolling("{\"id\":\"job-1\",\"status\":\"queued\"}");
    AssemblyAiClient client =
        new AssemblyAiClient(
            properties(API_KEY),
            new ObjectMapper(),
            duration -> {
              throw new InterruptedException("request cancelled");
            });

    try {
      assertThatThrownBy(() -> client.pollUntilDone(JOB_ID))
          .isInstanceOf(AssemblyAiException.class)
          .extracting("kind")
          .isEqualTo(AssemblyAiException.Kind.INTERRUPTED);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    assertThat(requests).hasSize(1);
  }

  @Test
  void transcribe_shouldSubmitThenPoll() {
    stub("/v2/transcript", 200, "{\"id\":\"job-1\",\"status\":\"queued\"}");
    stubPolling("{\"id\":\"job-1\",\"status\":\"completed\",\"text\":\"hello world\"}");

    String text = client(API_KEY).transcribe("https://cdn.assemblyai.com/upload/abc");

    assertThat(text).isEqualTo("hello world");
    assertThat(requests).extracting(RecordedRequest::path)
        .containsExactly("/v2/transcript", "/v2/transcript/job-1");
  }

  private AssemblyAiClient client(String apiKey) {
    return new AssemblyAiClient(properties(apiKey), new ObjectMapper(), sleeps::add);
  }

  private AssemblyAiProperties properties(String apiKey) {
    return new AssemblyAiProperties(
        "http://127.0.0.1:" + server.getAddress().getPort(),
        apiKey,
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        Duration.ofSeconds(3),
        120);
  }

  private void stub(String path, int status, String body) {
    server.createContext(path, exchange -> reply(exchange, status, body));
  }

  /** Serve the given bodies in order; the last one is repeated once the others are used up. */
  private void stubPolling(String... bodies) {
    pollResponses.addAll(List.of(bodies));
    server.createContext(
        "/v2/transcript/" + JOB_ID,
        exchange -> {
          String body = pollResponses.size() > 1 ? pollResponses.poll() : pollResponses.peek();
          reply(exchange, 200, body);
        });
  }

  private void reply(HttpExchange exchange, int status, String body) throws IOException {
    requests.add(
        new RecordedRequest(
            exchange.getRequestMethod(),
            exchange.getRequestURI().getPath(),
            exchange.getRequestHeaders().getFirst("authorization"),
            exchange.getRequestHeaders().getFirst("Content-Type"),
            exchange.getRequestBody().readAllBytes()));

    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private record RecordedRequest(
      String method, String path, String authorization, String contentType, byte[] body) {

    String bodyText() {
      return new String(body, StandardCharsets.UTF_8);
    }
  }
}
