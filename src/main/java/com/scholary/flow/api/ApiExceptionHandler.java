package com.scholary.flow.api;

import com.scholary.flow.service.YouTubeTranscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request bodies that cannot be read as a {@link TranscriptionRequest} to the same 400
 * response as a request without a {@code url}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    HttpMediaTypeNotSupportedException.class
  })
  public ResponseEntity<TranscriptionResponse> handleUnreadableBody(Exception e) {
    LOGGER.warn("Rejected unreadable request body: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(TranscriptionResponse.failure(YouTubeTranscriptionService.MISSING_URL_MESSAGE));
  }
}
