package com.scholary.flow.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method sets the fields of one workflow event, writes a single log line and removes the
 * fields again. Request-wide fields ({@code requestId}, {@code videoId}) are set once per request
 * through {@link #setRequestContext}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log download started event. */
  public void logDownloadStarted(String videoId) {
    try {
      MDC.put("event_type", "download_started");
      logger.info("Downloading audio for video: {}", videoId);
    } finally {
      clearEventFields();
    }
  }

  /** Log download finished event. */
  public void logDownloadFinished(String localPath, String format, long downloadMs) {
    try {
      MDC.put("event_type", "download_finished");
      MDC.put("localPath", localPath);
      MDC.put("format", format);
      MDC.put("downloadMs", String.valueOf(downloadMs));

      logger.info("Downloaded to: {} (format={}, {}ms)", localPath, format, downloadMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log upload started event. */
  public void logUploadStarted(String localPath) {
    try {
      MDC.put("event_type", "upload_started");
      MDC.put("localPath", localPath);

      logger.info("Uploading to AssemblyAI: {}", localPath);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription started event. */
  public void logTranscriptionStarted(String uploadUrl) {
    try {
      MDC.put("event_type", "transcription_started");

      logger.info("Uploaded, starting transcription");
      logger.debug("Upload URL: {}", uploadUrl);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription finished event. */
  public void logTranscriptionFinished(int transcriptChars, long totalMs) {
    try {
      MDC.put("event_type", "transcription_finished");
      MDC.put("transcriptChars", String.valueOf(transcriptChars));
      MDC.put("totalMs", String.valueOf(totalMs));

      logger.info("Transcription complete, {} chars in {}ms", transcriptChars, totalMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed request. */
  public void logTranscriptionFailed(String errorCategory, String errorType, String message) {
    try {
      MDC.put("event_type", "transcription_failed");
      MDC.put("errorCategory", errorCategory);
      MDC.put("errorType", errorType);

      logger.error(
          "Transcription failed: category={}, error={}, message={}",
          errorCategory,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log one provider status poll. */
  public void logPollStatus(String jobId, int attempt, int maxAttempts, String status) {
    try {
      MDC.put("event_type", "poll_status");
      MDC.put("jobId", jobId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("status", status);

      logger.debug(
          "Poll status: job={}, attempt={}/{}, status={}", jobId, attempt, maxAttempts, status);
    } finally {
      clearEventFields();
    }
  }

  /** Log a temporary file that could not be deleted. */
  public void logCleanupFailed(String localPath, String message) {
    try {
      MDC.put("event_type", "cleanup_failed");
      MDC.put("localPath", localPath);

      logger.warn("Failed to delete temporary audio file {}: {}", localPath, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId, String videoId) {
    MDC.put("requestId", requestId);
    if (videoId != null) {
      MDC.put("videoId", videoId);
    }
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("requestId");
    MDC.remove("videoId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("localPath");
    MDC.remove("format");
    MDC.remove("downloadMs");
    MDC.remove("transcriptChars");
    MDC.remove("totalMs");
    MDC.remove("errorCategory");
    MDC.remove("errorType");
    MDC.remove("jobId");
    MDC.remove("attempt");
    MDC.remove("status");
  }
}
