package com.scholary.flow.ytdlp;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class AudioFormatTest {

  @Test
  void fromExtension_shouldIgnoreCaseAndLeadingDot() {
    assertThat(AudioFormat.fromExtension(".M4A")).contains(AudioFormat.M4A);
    assertThat(AudioFormat.fromExtension("opus")).contains(AudioFormat.OPUS);
  }

  @Test
  void fromExtension_shouldRejectUnknownContainers() {
    assertThat(AudioFormat.fromExtension("wav")).isEmpty();
    assertThat(AudioFormat.fromExtension(null)).isEmpty();
  }

  @Test
  void fromPath_shouldUseLastExtension() {
    assertThat(AudioFormat.fromPath(Path.of("/tmp/yt_audio_1.webm.mp3"))).contains(AudioFormat.MP3);
    assertThat(AudioFormat.fromPath(Path.of("/tmp/yt_audio_1"))).isEmpty();
  }
}
