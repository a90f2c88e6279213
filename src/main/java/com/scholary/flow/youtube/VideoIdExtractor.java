package com.scholary.flow.youtube;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts the YouTube video id from a URL.
 *
 * <p>Recognized shapes:
 *
 * <ul>
 *   <li>{@code https://www.youtube.com/watch?v=ID}
 *   <li>{@code https://youtu.be/ID}
 *   <li>{@code https://www.youtube.com/embed/ID}
 *   <li>{@code https://www.youtube.com/watch?feature=share&v=ID}
 * </ul>
 *
 * <p>Patterns are tried in order and the first match wins. The id ends at the first {@code &},
 * {@code ?}, {@code #} or newline, so trailing query parameters and fragments are ignored.
 */
@Component
public class VideoIdExtractor {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile("(?:youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/embed/)([^&\\n?#]+)"),
          Pattern.compile("youtube\\.com/watch\\?.*v=([^&\\n?#]+)"));

  /**
   * Extract the video id.
   *
   * @param url the URL supplied by the caller, may be null
   * @return the video id, or empty if the URL is not a recognized YouTube URL
   */
  public Optional<String> extractVideoId(String url) {
    if (url == null) {
      return Optional.empty();
    }
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(url);
      if (matcher.find()) {
        return Optional.of(matcher.group(1));
      }
    }
    return Optional.empty();
  }
}
