package com.scholary.flow.ytdlp;

import com.scholary.flow.youtube.VideoIdExtractor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AudioRetriever} that shells out to yt-dlp.
 *
 * <p>Audio is extracted with {@code -x --audio-format <format>} into
 * {@code <tempDir>/yt_audio_<millis>_<uuid>.<format>}. yt-dlp sometimes keeps a different
 * container than the one requested (or appends a second extension), so after a successful run we
 * probe a fixed list of candidate names before giving up.
 */
@Component
public class YtDlpAudioRetriever implements AudioRetriever {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpAudioRetriever.class);

  private static final int ERROR_SNIPPET_MAX = 4_000;

  private final YtDlpProperties properties;
  private final ProcessRunner processRunner;
  private final TitleCache titleCache;
  private final VideoIdExtractor videoIdExtractor;
  private final AudioFormat requestedFormat;
  private final Path tempDir;

  public YtDlpAudioRetriever(
      YtDlpProperties properties,
      ProcessRunner processRunner,
      TitleCache titleCache,
      VideoIdExtractor videoIdExtractor) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.titleCache = titleCache;
    this.videoIdExtractor = videoIdExtractor;
    this.requestedFormat =
        AudioFormat.fromExtension(properties.audioFormat())
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Unsupported audio format: " + properties.audioFormat()));
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public String fetchTitle(String url) {
    String cacheKey = videoIdExtractor.extractVideoId(url).orElse(url);
    Optional<String> cached = titleCache.get(cacheKey);
    if (cached.isPresent()) {
      return cached.get();
    }

    List<String> command = List.of(properties.binary(), "--get-title", "--no-warnings", url);
    try {
      ProcessResult result = processRunner.run(command, properties.titleTimeout());
      String title = firstLine(result.stdout());
      if (result.succeeded() && !title.isEmpty()) {
        titleCache.put(cacheKey, title);
        return title;
      }
      LOGGER.warn(
          "Title lookup failed, using fallback: exitCode={}, timedOut={}, stderr={}",
          result.exitCode(),
          result.timedOut(),
          truncate(result.stderr()));
    } catch (IOException e) {
      LOGGER.warn("Could not start {} for title lookup: {}", properties.binary(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Title lookup interrupted, using fallback");
    } catch (RuntimeException e) {
      LOGGER.warn("Title lookup failed, using fallback", e);
    }
    return properties.fallbackTitle();
  }

  @Override
  public AudioAsset downloadAudio(String url) {
    Path outputPath = newOutputPath();
    List<String> command =
        List.of(
            properties.binary(),
            "-f",
            "bestaudio",
            "-x",
            "--audio-format",
            requestedFormat.extension(),
            "-o",
            outputPath.toString(),
            "--no-warnings",
            url);

    ProcessResult result;
    try {
      result = processRunner.run(command, properties.downloadTimeout());
    } catch (IOException e) {
      throw new AudioRetrievalException(
          AudioRetrievalException.Kind.TOOL_UNAVAILABLE,
          String.format(
              "%s is not installed or not on PATH: %s", properties.binary(), e.getMessage()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cleanupPartial(outputPath);
      throw new AudioRetrievalException(
          AudioRetrievalException.Kind.INTERRUPTED, "Audio download interrupted", e);
    }

    if (result.timedOut()) {
      cleanupPartial(outputPath);
      throw new AudioRetrievalException(
          AudioRetrievalException.Kind.DOWNLOAD_TIMEOUT, "Timeout while downloading video");
    }

    if (result.exitCode() != 0) {
      cleanupPartial(outputPath);
      throw new AudioRetrievalException(
          AudioRetrievalException.Kind.DOWNLOAD_FAILED,
          "yt-dlp error: " + truncate(result.stderr()));
    }

    Optional<Path> located = locateOutput(outputPath);
    if (located.isEmpty()) {
      cleanupPartial(outputPath);
      throw new AudioRetrievalException(
          AudioRetrievalException.Kind.FILE_NOT_FOUND, "Audio file not found after download");
    }
    Path found = located.get();

    AudioFormat format = AudioFormat.fromPath(found).orElse(requestedFormat);
    return new AudioAsset(found, format);
  }

  /** Candidate file names in probe order, the requested output path first. */
  List<Path> candidatePaths(Path outputPath) {
    String fileName = outputPath.getFileName().toString();
    String baseName = stripExtension(fileName);

    Set<Path> candidates = new LinkedHashSet<>();
    candidates.add(outputPath);
    candidates.add(outputPath.resolveSibling(fileName + "." + requestedFormat.extension()));
    candidates.add(outputPath.resolveSibling(baseName + "." + requestedFormat.extension()));
    for (AudioFormat format : AudioFormat.values()) {
      candidates.add(outputPath.resolveSibling(baseName + "." + format.extension()));
    }
    return new ArrayList<>(candidates);
  }

  private Optional<Path> locateOutput(Path outputPath) {
    for (Path candidate : candidatePaths(outputPath)) {
      if (Files.isRegularFile(candidate)) {
        if (!candidate.equals(outputPath)) {
          LOGGER.info("yt-dlp wrote {} instead of {}", candidate.getFileName(), outputPath.getFileName());
        }
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private Path newOutputPath() {
    String name =
        String.format(
            "yt_audio_%d_%s.%s",
            System.currentTimeMillis(), UUID.randomUUID(), requestedFormat.extension());
    return tempDir.resolve(name);
  }

  private void cleanupPartial(Path outputPath) {
    for (Path candidate : candidatePaths(outputPath)) {
      deleteQuietly(candidate);
      deleteQuietly(candidate.resolveSibling(candidate.getFileName() + ".part"));
    }
  }

  private void deleteQuietly(Path path) {
    try {
      if (Files.deleteIfExists(path)) {
        LOGGER.debug("Removed partial download: {}", path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to remove partial download {}: {}", path, e.getMessage());
    }
  }

  private static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private static String firstLine(String output) {
    if (output == null) {
      return "";
    }
    for (String line : output.split("\\R")) {
      if (!line.isBlank()) {
        return line.strip();
      }
    }
    return "";
  }

  private static String truncate(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    String trimmed = output.strip();
    if (trimmed.length() <= ERROR_SNIPPET_MAX) {
      return trimmed;
    }
    return trimmed.substring(0, ERROR_SNIPPET_MAX) + "...";
  }
}
