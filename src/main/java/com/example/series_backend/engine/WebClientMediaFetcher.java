package com.example.series_backend.engine;

import com.example.series_backend.engine.Interfaces.MediaFetcher;
import com.example.series_backend.exception.GenerationException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Downloads media by URL. {@code file:} URLs written by the local object store are read from disk.
 */
public class WebClientMediaFetcher implements MediaFetcher {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientMediaFetcher(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public Download fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new GenerationException("Media url is blank");
        }
        URI uri = URI.create(url);
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            return readFile(Path.of(uri));
        }
        ResponseEntity<byte[]> response = webClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                        .map(body -> new GenerationException("Download failed HTTP %s for %s".formatted(resp.statusCode(), url))))
                .toEntity(byte[].class)
                .block(timeout);
        if (response == null || response.getBody() == null) {
            throw new GenerationException("Empty download for " + url);
        }
        MediaType ct = response.getHeaders().getContentType();
        return new Download(response.getBody(), ct != null ? ct.toString() : null);
    }

    private Download readFile(Path path) {
        try {
            return new Download(Files.readAllBytes(path), Files.probeContentType(path));
        } catch (IOException e) {
            throw new GenerationException("Read failed for " + path, e);
        }
    }
}
