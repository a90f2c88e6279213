package com.scholary.flow.assemblyai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Transcript resource returned by {@code POST /v2/transcript} and {@code GET /v2/transcript/{id}}.
 *
 * <p>{@code text} is only present once the job is completed, {@code error} only when it failed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptResponse(String id, String status, String text, String error) {}
