package com.flamingo.ai.ragworkbench.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for the browser-based RAG workbench UI. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final ChunkingConfig chunkingConfig;

  /**
   * Allows the UI origins configured under {@code chunking.cors.allowed-origins} to call the API.
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/api/**")
        .allowedOrigins(chunkingConfig.getCors().getAllowedOrigins().toArray(String[]::new))
        .allowedMethods("GET", "POST", "OPTIONS")
        .maxAge(3600);
  }
}
