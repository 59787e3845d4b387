package com.flamingo.ai.scopetree.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for asynchronous build responses. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final ScopeTreeProperties properties;

  /** Bounds how long a request waits on a build running in {@code scopeTreeExecutor}. */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setDefaultTimeout(properties.getRequestTimeout().toMillis());
  }
}
