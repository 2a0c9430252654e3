package com.linkshelf.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RefreshConfig {

    @Bean
    public SchedulerConfig schedulerConfig(RefreshProperties properties) {
        return SchedulerConfig.from(properties);
    }

    @Bean(name = "refreshExecutor", destroyMethod = "shutdown")
    public ExecutorService refreshExecutor(SchedulerConfig schedulerConfig) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(schedulerConfig.maxConcurrency(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("link-refresh-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "githubHttpClient")
    public HttpClient githubHttpClient(RefreshProperties properties) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(Math.max(1, properties.getRequestTimeoutSeconds())))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
