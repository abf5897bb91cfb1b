package com.example.series_backend.config;

import com.example.series_backend.engine.GradientClient;
import com.example.series_backend.engine.HttpVideoGenerator;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(GenerationClientProperties.class)
public class GenerationClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 15_000;
    private static final int MAX_IN_MEMORY_BYTES = 128 * 1024 * 1024;

    @Bean
    @ConditionalOnProperty(prefix = "generation.video", name = "enabled", havingValue = "true")
    public VideoGenerator videoGenerator(GenerationClientProperties props) {
        GenerationClientProperties.Video video = props.getVideo();
        LOGGER.info("Video generator wired baseUrl={} timeout={}s", video.getBaseUrl(), video.getTimeoutSeconds());
        return new HttpVideoGenerator(webClient(video.getBaseUrl(), Duration.ofSeconds(video.getTimeoutSeconds()), null), video);
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation.gradient", name = "enabled", havingValue = "true")
    public GradientClient gradientClient(GenerationClientProperties props) {
        GenerationClientProperties.Gradient gradient = props.getGradient();
        LOGGER.info("Gradient client wired baseUrl={} model={}", gradient.getBaseUrl(), gradient.getModel());
        return new GradientClient(webClient(gradient.getBaseUrl(), Duration.ofSeconds(gradient.getTimeoutSeconds()), gradient.getApiKey()), gradient);
    }

    static WebClient webClient(String baseUrl, Duration timeout, String apiKey) {
        int seconds = (int) Math.max(1, timeout.getSeconds());
        HttpClient http = HttpClient.create()
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(seconds, TimeUnit.SECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey.trim());
        }
        return builder.build();
    }
}
