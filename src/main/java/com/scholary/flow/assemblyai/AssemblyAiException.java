package com.scholary.flow.assemblyai;

/**
 * Exception thrown when a call to AssemblyAI fails.
 *
 * <p>Provider-reported errors are terminal; nothing here is retried.
 */
public class AssemblyAiException extends RuntimeException {

  public enum Kind {
    UPLOAD_FAILED,
    SUBMIT_FAILED,
    POLL_FAILED,
    TRANSCRIPTION_FAILED,
    TRANSCRIPTION_TIMEOUT,
    INTERRUPTED
  }

  private final Kind kind;

  public AssemblyAiException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public AssemblyAiException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
