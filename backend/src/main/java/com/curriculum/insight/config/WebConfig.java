package com.curriculum.insight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  // Correlation id is echoed back by UserMdcFilter and must be readable by browser clients.
  private static final String[] EXPOSED_HEADERS = {"X-Correlation-Id"};

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    CorsRegistration api =
        registry
            .addMapping("/api/**")
            .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
            .allowedHeaders("*")
            .exposedHeaders(EXPOSED_HEADERS);
    if (allowedOrigins.length == 0) {
      api.allowedOriginPatterns("*");
    } else {
      api.allowedOrigins(allowedOrigins).allowCredentials(true);
    }
  }
}
