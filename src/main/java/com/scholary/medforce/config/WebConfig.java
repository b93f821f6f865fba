package com.scholary.medforce.config;

import com.scholary.medforce.session.SessionProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Opens the document API to the same origins as the WebSocket endpoints. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final SessionProperties properties;

  public WebConfig(SessionProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/api/**")
        .allowedOriginPatterns(properties.allowedOrigins().toArray(new String[0]))
        .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
        .allowedHeaders("*");
  }
}
