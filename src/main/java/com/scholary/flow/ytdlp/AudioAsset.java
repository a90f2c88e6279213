package com.scholary.flow.ytdlp;

import com.scholary.flow.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A downloaded audio file in the temporary directory.
 *
 * <p>Owned by a single request. Closing it deletes the file; close is idempotent and never throws,
 * so a failed deletion cannot replace the outcome of the request that used it. Use it in a
 * try-with-resources block.
 */
public final class AudioAsset implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioAsset.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Path localPath;
  private final AudioFormat format;
  private final AtomicBoolean released = new AtomicBoolean();

  public AudioAsset(Path localPath, AudioFormat format) {
    this.localPath = localPath;
    this.format = format;
  }

  public Path localPath() {
    return localPath;
  }

  public AudioFormat format() {
    return format;
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Delete the file. Only the first call has an effect. */
  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      if (Files.deleteIfExists(localPath)) {
        LOGGER.debug("Deleted temporary audio file: {}", localPath);
      }
    } catch (IOException | SecurityException e) {
      STRUCTURED_LOGGER.logCleanupFailed(localPath.toString(), e.getMessage());
    }
  }

  @Override
  public String toString() {
    return "AudioAsset[" + localPath + ", " + format + "]";
  }
}
