package com.scholary.flow.ytdlp;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Audio containers yt-dlp may leave behind after extraction.
 *
 * <p>Declaration order is the probe order used when the requested container is not found.
 */
public enum AudioFormat {
  MP3("mp3"),
  M4A("m4a"),
  WEBM("webm"),
  OPUS("opus");

  private final String extension;

  AudioFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  public static Optional<AudioFormat> fromExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    String normalized = extension.toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    for (AudioFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Format of a file judged by its last extension. */
  public static Optional<AudioFormat> fromPath(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return Optional.empty();
    }
    return fromExtension(name.substring(dot + 1));
  }
}
