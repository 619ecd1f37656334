package com.flamingo.ai.raggateway.config;

import com.flamingo.ai.raggateway.query.ContextRetriever;
import com.flamingo.ai.raggateway.query.NoContextRetriever;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Query-side beans that deployments may replace. */
@Configuration
public class QueryConfig {

  @Bean
  @ConditionalOnMissingBean(ContextRetriever.class)
  public ContextRetriever contextRetriever() {
    return new NoContextRetriever();
  }
}
