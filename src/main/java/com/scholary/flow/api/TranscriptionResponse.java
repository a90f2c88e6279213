package com.scholary.flow.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.flow.youtube.VideoIdentity;

/**
 * Response of the transcription endpoint.
 *
 * <p>On success {@code transcript}, {@code title} and {@code videoId} are set; on failure only
 * {@code error}. Absent fields are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionResponse(
    boolean success, String transcript, String title, String videoId, String error) {

  public static TranscriptionResponse success(String transcript, VideoIdentity video) {
    return new TranscriptionResponse(true, transcript, video.title(), video.videoId(), null);
  }

  public static TranscriptionResponse failure(String error) {
    return new TranscriptionResponse(false, null, null, null, error);
  }
}
