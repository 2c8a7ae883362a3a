package com.scholary.videoengine.config;

import com.scholary.videoengine.stage.ProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Binds the "pipeline.*" and "providers.*" settings. */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, ProviderProperties.class})
public class PipelineConfig {}
