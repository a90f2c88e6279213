package com.scholary.flow.service;

import com.scholary.flow.api.TranscriptionRequest;
import com.scholary.flow.api.TranscriptionResponse;
import com.scholary.flow.assemblyai.AssemblyAiException;
import com.scholary.flow.assemblyai.AssemblyAiService;
import com.scholary.flow.logging.StructuredLogger;
import com.scholary.flow.youtube.VideoIdExtractor;
import com.scholary.flow.youtube.VideoIdentity;
import com.scholary.flow.ytdlp.AudioAsset;
import com.scholary.flow.ytdlp.AudioRetrievalException;
import com.scholary.flow.ytdlp.AudioRetriever;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the transcription of one YouTube video.
 *
 * <p>Steps, in order, stopping at the first failure:
 *
 * <ol>
 *   <li>Validate the request and extract the video id
 *   <li>Look up the title (best-effort)
 *   <li>Download the audio with yt-dlp
 *   <li>Upload it to AssemblyAI
 *   <li>Submit the job and poll until it finishes
 * </ol>
 *
 * <p>The downloaded file is held in a try-with-resources block, so it is deleted whether the
 * upload and transcription succeed or throw. Failures are turned into a {@link
 * TranscriptionOutcome} here and nowhere else.
 */
@Service
public class YouTubeTranscriptionService {

  public static final String MISSING_URL_MESSAGE = "Missing 'url' in request body";
  public static final String INVALID_URL_MESSAGE = "Invalid YouTube URL";

  private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeTranscriptionService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final VideoIdExtractor videoIdExtractor;
  private final AudioRetriever audioRetriever;
  private final AssemblyAiService assemblyAiService;

  public YouTubeTranscriptionService(
      VideoIdExtractor videoIdExtractor,
      AudioRetriever audioRetriever,
      AssemblyAiService assemblyAiService) {
    this.videoIdExtractor = videoIdExtractor;
    this.audioRetriever = audioRetriever;
    this.assemblyAiService = assemblyAiService;
  }

  /**
   * Transcribe the video named in the request.
   *
   * @param request the request, may be null when no body was sent
   * @return the outcome; never throws for downstream failures
   */
  public TranscriptionOutcome transcribe(TranscriptionRequest request) {
    String requestId = UUID.randomUUID().toString();
    StructuredLogger.setRequestContext(requestId, null);

    try {
      if (request == null || request.url() == null) {
        LOGGER.warn("Rejected request: missing url");
        return TranscriptionOutcome.failure(ErrorCategory.CLIENT_INPUT, MISSING_URL_MESSAGE);
      }

      Optional<String> videoId = videoIdExtractor.extractVideoId(request.url());
      if (videoId.isEmpty()) {
        LOGGER.warn("Rejected request: unrecognized url={}", request.url());
        return TranscriptionOutcome.failure(ErrorCategory.CLIENT_INPUT, INVALID_URL_MESSAGE);
      }

      StructuredLogger.setRequestContext(requestId, videoId.get());
      return process(request.url(), videoId.get());

    } catch (AudioRetrievalException e) {
      return failed(ErrorCategory.TOOL, e.getKind().name(), e.getMessage());
    } catch (AssemblyAiException e) {
      return failed(ErrorCategory.PROVIDER, e.getKind().name(), e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure during transcription", e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return failed(ErrorCategory.INTERNAL, e.getClass().getSimpleName(), message);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private TranscriptionOutcome process(String url, String videoId) {
    long startTime = System.currentTimeMillis();

    String title = audioRetriever.fetchTitle(url);
    VideoIdentity video = new VideoIdentity(videoId, title);

    structuredLogger.logDownloadStarted(videoId);
    long downloadStart = System.currentTimeMillis();
    try (AudioAsset audio = audioRetriever.downloadAudio(url)) {
      structuredLogger.logDownloadFinished(
          audio.localPath().toString(),
          audio.format().name(),
          System.currentTimeMillis() - downloadStart);

      structuredLogger.logUploadStarted(audio.localPath().toString());
      String uploadUrl = assemblyAiService.upload(audio.localPath());

      structuredLogger.logTranscriptionStarted(uploadUrl);
      String transcript = assemblyAiService.transcribe(uploadUrl);
      if (transcript == null) {
        transcript = "";
      }

      structuredLogger.logTranscriptionFinished(
          transcript.length(), System.currentTimeMillis() - startTime);
      return TranscriptionOutcome.success(TranscriptionResponse.success(transcript, video));
    }
  }

  private TranscriptionOutcome failed(ErrorCategory category, String errorType, String message) {
    structuredLogger.logTranscriptionFailed(category.name(), errorType, message);
    return TranscriptionOutcome.failure(category, message);
  }
}
