package com.scholary.flow.service;

/**
 * Where a failed request went wrong, and the HTTP status it maps to.
 *
 * <ul>
 *   <li>CLIENT_INPUT: missing or unrecognized URL, the caller must fix the request
 *   <li>TOOL: yt-dlp is missing, failed or timed out
 *   <li>PROVIDER: AssemblyAI rejected a call, reported an error or never finished
 *   <li>INTERNAL: anything else
 * </ul>
 */
public enum ErrorCategory {
  CLIENT_INPUT(400),
  TOOL(500),
  PROVIDER(500),
  INTERNAL(500);

  private final int httpStatus;

  ErrorCategory(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
