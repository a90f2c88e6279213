package com.scholary.flow.assemblyai;

/**
 * Status of a transcription job as reported by AssemblyAI.
 *
 * <p>Jobs move from {@code queued} to {@code processing} and end in {@code completed} or
 * {@code error}. Anything else is mapped to {@link #UNKNOWN} and polled again.
 */
public enum TranscriptStatus {
  QUEUED("queued"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  ERROR("error"),
  UNKNOWN("unknown");

  private final String value;

  TranscriptStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static TranscriptStatus fromValue(String value) {
    if (value != null) {
      for (TranscriptStatus status : values()) {
        if (status.value.equalsIgnoreCase(value.trim())) {
          return status;
        }
      }
    }
    return UNKNOWN;
  }
}
