package com.scholary.flow.ytdlp;

/**
 * Retrieves metadata and audio for a video URL.
 *
 * <p>This abstraction keeps the orchestration independent of the download tool, and lets tests
 * replace it with a mock.
 */
public interface AudioRetriever {

  /**
   * Look up the human-readable title of a video.
   *
   * <p>Best-effort: any failure yields the configured fallback title.
   *
   * @param url the video URL
   * @return the title, never null
   */
  String fetchTitle(String url);

  /**
   * Download the audio track of a video into a uniquely named temporary file.
   *
   * <p>The caller owns the returned asset and must close it to delete the file.
   *
   * @param url the video URL
   * @return the downloaded audio
   * @throws AudioRetrievalException if the tool is missing, fails, times out or produces no file
   */
  AudioAsset downloadAudio(String url);
}
