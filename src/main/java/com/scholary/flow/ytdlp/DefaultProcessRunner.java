package com.scholary.flow.ytdlp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained on their own threads so a chatty process cannot block on a full
 * pipe while we wait for it.
 */
@Component
public class DefaultProcessRunner implements ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessRunner.class);

  private static final Duration KILL_GRACE = Duration.ofSeconds(5);

  @Override
  public ProcessResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).start();
    OutputCollector stdout = new OutputCollector(process.getInputStream(), "process-stdout");
    OutputCollector stderr = new OutputCollector(process.getErrorStream(), "process-stderr");
    stdout.start();
    stderr.start();

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      killTree(process);
      throw e;
    }

    if (!finished) {
      LOGGER.warn("Process exceeded {}s, killing: {}", timeout.toSeconds(), command.get(0));
      killTree(process);
      process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
    }

    String out = stdout.await();
    String err = stderr.await();
    int exitCode = finished ? process.exitValue() : -1;
    return new ProcessResult(exitCode, out, err, !finished);
  }

  /**
   * Kill the process and everything it started, such as the ffmpeg child of yt-dlp. Descendants
   * must be collected while the parent is alive; orphans are no longer reported as descendants.
   */
  private static void killTree(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private static final class OutputCollector extends Thread {

    private final InputStream stream;
    private final StringJoiner lines = new StringJoiner(System.lineSeparator());

    OutputCollector(InputStream stream, String name) {
      super(name);
      this.stream = stream;
      setDaemon(true);
    }

    @Override
    public void run() {
      try (BufferedReader reader =
          new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          synchronized (lines) {
            lines.add(line);
          }
        }
      } catch (IOException e) {
        // Exit code and timeout decide the outcome; what was read so far is kept.
        LOGGER.debug("Stopped reading process output: {}", e.getMessage());
      }
    }

    String await() throws InterruptedException {
      join(KILL_GRACE.toMillis());
      synchronized (lines) {
        return lines.toString();
      }
    }
  }
}
