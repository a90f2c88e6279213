package com.scholary.flow.ytdlp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of TitleCache using Caffeine.
 *
 * <p>Bounded in size and expired after write, configured under {@code ytdlp.title-cache}.
 */
@Component
public class CaffeineTitleCache implements TitleCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineTitleCache.class);

  private final Cache<String, String> cache;

  public CaffeineTitleCache(YtDlpProperties properties) {
    YtDlpProperties.TitleCacheProperties settings = properties.titleCache();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(settings.maxSize())
            .expireAfterWrite(settings.ttl())
            .build();

    LOGGER.info(
        "Initialized title cache: maxSize={}, ttl={}", settings.maxSize(), settings.ttl());
  }

  @Override
  public void put(String videoKey, String title) {
    cache.put(videoKey, title);
  }

  @Override
  public Optional<String> get(String videoKey) {
    String title = cache.getIfPresent(videoKey);
    if (title != null) {
      LOGGER.debug("Title cache hit: key={}", videoKey);
    }
    return Optional.ofNullable(title);
  }
}
