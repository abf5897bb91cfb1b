package com.example.series_backend.config;

import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.service.LocalObjectStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "storage.local", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ObjectStore objectStore(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var store = new LocalObjectStore(base, properties.getPublicBaseUrl());
        org.slf4j.LoggerFactory.getLogger(StorageConfig.class)
                .info("Object store wired: base={}, publicBaseUrl={}", base, properties.getPublicBaseUrl());
        return store;
    }
}
