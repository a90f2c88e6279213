package com.scholary.flow.api;

/**
 * Request for transcribing a YouTube video.
 *
 * <p>{@code url} is checked by the service rather than with bean validation so a missing field and
 * an unrecognized URL produce their own error messages.
 */
public record TranscriptionRequest(String url) {}
