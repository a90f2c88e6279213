package com.scholary.flow.assemblyai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Response of {@code POST /v2/upload}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadResponse(@JsonProperty("upload_url") String uploadUrl) {}
