package com.scholary.flow.service;

import com.scholary.flow.api.TranscriptionResponse;

/**
 * Result of one transcription request: the response payload and, for failures, the error
 * category that decides the HTTP status.
 */
public record TranscriptionOutcome(ErrorCategory errorCategory, TranscriptionResponse response) {

  public static TranscriptionOutcome success(TranscriptionResponse response) {
    return new TranscriptionOutcome(null, response);
  }

  public static TranscriptionOutcome failure(ErrorCategory category, String message) {
    return new TranscriptionOutcome(category, TranscriptionResponse.failure(message));
  }

  public boolean isSuccess() {
    return errorCategory == null;
  }

  public int httpStatus() {
    return isSuccess() ? 200 : errorCategory.httpStatus();
  }
}
