package com.scholary.flow.ytdlp;

/**
 * Exception thrown when audio cannot be retrieved for a video.
 *
 * <p>The {@link Kind} tells apart a missing tool from a failed, timed out or empty download. None
 * of them are retried.
 */
public class AudioRetrievalException extends RuntimeException {

  public enum Kind {
    TOOL_UNAVAILABLE,
    DOWNLOAD_FAILED,
    DOWNLOAD_TIMEOUT,
    FILE_NOT_FOUND,
    INTERRUPTED
  }

  private final Kind kind;

  public AudioRetrievalException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public AudioRetrievalException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
