package com.strategylab.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/** HTTP client used to reach the single-run backtest service. */
@Configuration
public class EvaluatorConfig {

    @Bean("evaluatorRestTemplate")
    public RestTemplate evaluatorRestTemplate(RestTemplateBuilder builder, EvaluatorProperties evaluatorProperties) {
        return builder.connectTimeout(evaluatorProperties.getConnectTimeout())
                .readTimeout(evaluatorProperties.getTimeout())
                .build();
    }
}
