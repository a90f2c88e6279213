package com.scholary.flow.ytdlp;

/** Outcome of a finished or killed subprocess. {@code exitCode} is -1 when it timed out. */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

  public boolean succeeded() {
    return !timedOut && exitCode == 0;
  }
}
