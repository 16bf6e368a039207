package com.catalog.importer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ImporterConfig {

    @Bean(name = "importExecutor", destroyMethod = "shutdownNow")
    public ExecutorService importExecutor(ImporterProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorker().getConcurrency(), namedThreads("import-worker"));
    }

    @Bean(name = "webhookExecutor", destroyMethod = "shutdown")
    public ExecutorService webhookExecutor(ImporterProperties properties) {
        return Executors.newFixedThreadPool(properties.getWebhook().getConcurrency(), namedThreads("webhook-delivery"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ImporterProperties properties) {
        int size = Math.max(2, properties.getWebhook().getConcurrency());
        return Executors.newFixedThreadPool(size, namedThreads("webhook-http"));
    }

    @Bean(name = "webhookRetryScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService webhookRetryScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("webhook-retry"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
