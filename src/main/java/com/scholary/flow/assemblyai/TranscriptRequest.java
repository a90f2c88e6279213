package com.scholary.flow.assemblyai;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /v2/transcript}. */
public record TranscriptRequest(@JsonProperty("audio_url") String audioUrl) {}
