package com.example.series_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the scheduling and production configuration properties.
 */
@Configuration
@EnableConfigurationProperties({VotingProperties.class, ProductionProperties.class, TickProperties.class})
public class AppPropertiesConfig {
}
