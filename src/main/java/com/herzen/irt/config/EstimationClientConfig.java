package com.herzen.irt.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class EstimationClientConfig {

    @Bean
    public RestTemplate estimationRestTemplate(RestTemplateBuilder builder, IrtProperties properties) {
        IrtProperties.Estimation estimation = properties.estimation();
        return builder
                .rootUri(estimation.baseUrl())
                .setConnectTimeout(estimation.connectTimeout())
                .setReadTimeout(estimation.readTimeout())
                .build();
    }
}
