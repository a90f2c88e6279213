package com.scholary.flow.config;

import com.scholary.flow.ytdlp.YtDlpProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for yt-dlp related beans.
 *
 * <p>Enables the YtDlpProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(YtDlpProperties.class)
public class YtDlpConfig {}
