package com.autonomous.quota.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class UpstreamClientConfig {

    @Bean
    public RestTemplate upstreamRestTemplate(
            RestTemplateBuilder builder,
            @Value("${quota.upstream.connect-timeout:10s}") Duration connectTimeout
    ) {
        return builder
            .setConnectTimeout(connectTimeout)
            .build();
    }
}
