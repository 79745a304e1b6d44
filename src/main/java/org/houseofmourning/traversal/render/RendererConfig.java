package org.houseofmourning.traversal.render;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RendererConfig {

  @Bean
  @ConditionalOnMissingBean(RendererPort.class)
  public RendererPort loggingRendererPort() {
    return new LoggingRendererPort();
  }
}
