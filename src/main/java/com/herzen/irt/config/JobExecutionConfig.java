package com.herzen.irt.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class JobExecutionConfig {

    @Bean
    public ThreadPoolTaskExecutor analysisJobExecutor(IrtProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.jobs().poolSize());
        executor.setMaxPoolSize(properties.jobs().poolSize());
        executor.setThreadNamePrefix("irt-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
