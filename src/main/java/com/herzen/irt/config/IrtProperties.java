package com.herzen.irt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "irt")
public record IrtProperties(@DefaultValue Estimation estimation,
                            @DefaultValue Sessions sessions,
                            @DefaultValue Jobs jobs) {

    public record Estimation(@DefaultValue("http://localhost:8001") String baseUrl,
                             @DefaultValue("5s") Duration connectTimeout,
                             @DefaultValue("300s") Duration readTimeout,
                             @DefaultValue("12345") long seed,
                             @DefaultValue("10000") int maxCycles) {}

    public record Sessions(@DefaultValue("PT1H") Duration ttl,
                           @DefaultValue("300000") long purgeFixedDelayMs) {}

    public record Jobs(@DefaultValue("PT10M") Duration deadline,
                       @DefaultValue("2") int poolSize) {}
}
