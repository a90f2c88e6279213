package com.scholary.flow.ytdlp;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Runs an external command and collects its output. */
public interface ProcessRunner {

  /**
   * Run a command and wait for it to finish.
   *
   * <p>A process that outlives {@code timeout} is killed and reported with {@code timedOut=true}.
   *
   * @param command the executable followed by its arguments
   * @param timeout the maximum time to wait
   * @return exit code and captured stdout/stderr
   * @throws IOException if the executable cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  ProcessResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException;
}
