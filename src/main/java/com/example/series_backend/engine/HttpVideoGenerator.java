package com.example.series_backend.engine;

import com.example.series_backend.config.GenerationClientProperties;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.exception.GenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls a hosted text-to-video endpoint that answers with the clip as base64.
 */
public class HttpVideoGenerator implements VideoGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpVideoGenerator.class);
    private static final int RETRY_MAX_ATTEMPTS = 2;
    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final GenerationClientProperties.Video props;

    public HttpVideoGenerator(WebClient webClient, GenerationClientProperties.Video props) {
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public Result generate(Request request) {
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new GenerationException("Prompt is required");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", request.prompt());
        body.put("audio_text", request.narrationText());
        body.put("negative_prompt", props.getNegativePrompt());
        body.put("num_frames", props.getNumFrames());
        body.put("fps", props.getFps());
        body.put("width", request.width());
        body.put("height", request.height());
        body.put("num_inference_steps", props.getInferenceSteps());
        body.put("guidance_scale", props.getGuidanceScale());
        body.put("seed", request.seed());

        long t0 = System.nanoTime();
        JsonNode root;
        try {
            root = webClient.post()
                    .uri(props.getPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new GenerationException("Video generation error %s: %s".formatted(resp.statusCode(), err))))
                    .bodyToMono(JsonNode.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(HttpVideoGenerator::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn("Video generation retry attempt={} cause={}",
                                    signal.totalRetriesInARow() + 1, signal.failure().toString())))
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Video generation call failed: " + e.getMessage(), e);
        }

        if (root == null || !root.hasNonNull("video_base64")) {
            throw new GenerationException("Video generation returned no video");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(root.get("video_base64").asText());
        } catch (IllegalArgumentException e) {
            throw new GenerationException("Video generation returned invalid base64", e);
        }
        Long seed = root.hasNonNull("seed") ? root.get("seed").asLong() : request.seed();
        String model = root.hasNonNull("model") ? root.get("model").asText() : null;
        Double duration = root.hasNonNull("duration") ? root.get("duration").asDouble() : null;

        LOGGER.info("Video generated bytes={} model={} seed={} in={}ms", bytes.length, model, seed, (System.nanoTime() - t0) / 1_000_000);
        return new Result(bytes, seed, model, duration);
    }

    private static boolean isRetryable(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof PrematureCloseException || cur instanceof ConnectException) return true;
            cur = cur.getCause();
        }
        return false;
    }
}
