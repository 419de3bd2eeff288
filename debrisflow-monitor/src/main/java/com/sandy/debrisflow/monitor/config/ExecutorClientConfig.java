package com.sandy.debrisflow.monitor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class ExecutorClientConfig {

    @Bean
    public RestTemplate executorRestTemplate(RestTemplateBuilder builder,
                                             @Value("${simulation.executor.connect-timeout:PT5S}") Duration connectTimeout,
                                             @Value("${simulation.executor.read-timeout:PT30S}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
