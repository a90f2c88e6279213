package com.scholary.flow.ytdlp;

import java.util.Optional;

/**
 * Cache of video titles keyed by video id.
 *
 * <p>Titles rarely change, so a repeated request for the same video can skip the yt-dlp title
 * lookup.
 */
public interface TitleCache {

  void put(String videoKey, String title);

  Optional<String> get(String videoKey);
}
