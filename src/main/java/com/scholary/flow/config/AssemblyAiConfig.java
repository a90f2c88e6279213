package com.scholary.flow.config;

import com.scholary.flow.assemblyai.AssemblyAiProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AssemblyAI client.
 *
 * <p>Enables the AssemblyAiProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AssemblyAiProperties.class)
public class AssemblyAiConfig {}
