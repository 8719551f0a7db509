package com.delta.redirects.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ResolverConfig {

    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor(ResolverProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getBatchSize());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ResolverProperties properties) {
        int size = Math.max(4, properties.getPipeline().getBatchSize() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "runExecutor", destroyMethod = "shutdown")
    public ExecutorService runExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
