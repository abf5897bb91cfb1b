package com.example.series_backend.engine;

import com.example.series_backend.config.GenerationClientProperties;
import com.example.series_backend.engine.Interfaces.NarrationSynthesizer;
import com.example.series_backend.engine.Interfaces.PromptRefiner;
import com.example.series_backend.exception.GenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the inference gateway: chat completions for prompt refinement and asynchronous
 * text-to-speech jobs for narration.
 */
public class GradientClient implements PromptRefiner, NarrationSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GradientClient.class);

    static final String REFINE_SYSTEM_PROMPT = """
            You are a cinematographer and prompt engineer for AI video generation.
            Transform rough scene descriptions into detailed, cinematic prompts.
            Add specific camera angles and movements, describe lighting precisely, include atmospheric
            details, specify the visual style and keep the prompt under 200 words.
            Describe only what is visually happening.
            Output ONLY the refined prompt, no explanations.""";

    private final WebClient webClient;
    private final GenerationClientProperties.Gradient props;

    public GradientClient(WebClient webClient, GenerationClientProperties.Gradient props) {
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public String refine(String rawPrompt) {
        Map<String, Object> body = Map.of(
                "model", props.getModel(),
                "temperature", 0.8,
                "max_tokens", 300,
                "messages", List.of(
                        Map.of("role", "system", "content", REFINE_SYSTEM_PROMPT),
                        Map.of("role", "user", "content", rawPrompt)
                ));
        JsonNode root = post("/v1/chat/completions", body);
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new GenerationException("Prompt refinement returned no content");
        }
        return content.trim();
    }

    @Override
    public Result synthesizeAndWait(String text, Duration timeout) {
        JsonNode created = post("/v1/audio/speech/jobs", Map.of(
                "input", text,
                "voice", props.getTtsVoice()));
        String jobId = created.path("id").asText("");
        if (jobId.isBlank()) {
            throw new GenerationException("TTS job was not created");
        }
        LOGGER.info("TTS job created id={} chars={}", jobId, text.length());

        long deadline = System.nanoTime() + timeout.toNanos();
        JsonNode state = created;
        while (true) {
            String status = state.path("status").asText("").toLowerCase(Locale.ROOT);
            if ("completed".equals(status) || "succeeded".equals(status)) {
                String audioUrl = state.path("audio_url").asText("");
                if (audioUrl.isBlank()) {
                    throw new GenerationException("TTS job " + jobId + " completed without audio_url");
                }
                String contentType = state.hasNonNull("content_type") ? state.get("content_type").asText() : null;
                return new Result(audioUrl, contentType);
            }
            if ("failed".equals(status) || "error".equals(status)) {
                throw new GenerationException("TTS job " + jobId + " failed: " + state.path("error").asText("unknown"));
            }
            if (System.nanoTime() > deadline) {
                throw new GenerationException("TTS job " + jobId + " timed out after " + timeout.toSeconds() + "s");
            }
            sleep(props.getPollIntervalMs());
            state = get("/v1/audio/speech/jobs/" + jobId);
        }
    }

    private JsonNode post(String path, Object body) {
        try {
            JsonNode node = webClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new GenerationException("Gradient error %s on %s: %s".formatted(resp.statusCode(), path, err))))
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            if (node == null) throw new GenerationException("Empty response from " + path);
            return node;
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Gradient call failed on " + path + ": " + e.getMessage(), e);
        }
    }

    private JsonNode get(String path) {
        try {
            JsonNode node = webClient.get()
                    .uri(path)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new GenerationException("Gradient error %s on %s: %s".formatted(resp.statusCode(), path, err))))
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            if (node == null) throw new GenerationException("Empty response from " + path);
            return node;
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Gradient call failed on " + path + ": " + e.getMessage(), e);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(Math.max(50, ms));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for TTS", e);
        }
    }
}
