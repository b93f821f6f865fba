package com.scholary.medforce.config;

import com.scholary.medforce.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the WhisperProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {}
