package com.delta.acquisition.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AcquisitionConfig {

    @Bean(name = "acquisitionExecutor", destroyMethod = "shutdown")
    public ExecutorService acquisitionExecutor(AcquisitionProperties properties) {
        int size = Math.max(2, properties.getPools().getWorker().getCapacity() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "acquisitionRunExecutor", destroyMethod = "shutdown")
    public ExecutorService acquisitionRunExecutor(AcquisitionProperties properties) {
        int size = Math.max(2, properties.getPools().getWorker().getCapacity() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "visionExecutor", destroyMethod = "shutdown")
    public ExecutorService visionExecutor(AcquisitionProperties properties) {
        int size = Math.max(4, properties.getPools().getWorker().getCapacity() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AcquisitionProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock acquisitionClock(AcquisitionProperties properties) {
        return Clock.system(ZoneId.of(properties.getCost().getZone()));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
