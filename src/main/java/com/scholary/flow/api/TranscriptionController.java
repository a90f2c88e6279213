package com.scholary.flow.api;

import com.scholary.flow.service.TranscriptionOutcome;
import com.scholary.flow.service.YouTubeTranscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for YouTube transcription.
 *
 * <p>The request is handled synchronously: the response is written once the transcript is ready
 * or the workflow has failed, which can take several minutes for long videos.
 */
@RestController
@Tag(name = "Transcription", description = "YouTube video transcription API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final YouTubeTranscriptionService transcriptionService;

  public TranscriptionController(YouTubeTranscriptionService transcriptionService) {
    this.transcriptionService = transcriptionService;
  }

  @PostMapping("/api/transcribe-youtube")
  @Operation(
      summary = "Transcribe a YouTube video",
      description =
          "Download the audio of a YouTube video, transcribe it with AssemblyAI and return the "
              + "transcript with the video title and id. 400 for a missing or unrecognized URL, "
              + "500 for any download or transcription failure.")
  public ResponseEntity<TranscriptionResponse> transcribeYouTube(
      @RequestBody(required = false) TranscriptionRequest request) {
    LOGGER.info("Transcribe request: url={}", request != null ? request.url() : null);

    TranscriptionOutcome outcome = transcriptionService.transcribe(request);
    return ResponseEntity.status(outcome.httpStatus()).body(outcome.response());
  }
}
