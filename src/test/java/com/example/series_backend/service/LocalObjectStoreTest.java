package com.example.series_backend.service;

import com.example.series_backend.exception.StorageException;
import com.example.series_backend.service.Interfaces.ObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalObjectStoreTest {

    @TempDir Path base;

    @Test
    void sameKeyOverwritesAndPublishesUnderTheBaseUrl() throws Exception {
        LocalObjectStore store = new LocalObjectStore(base, "https://cdn.example.com/");

        store.put("episodes/e1/final.mp4", new byte[]{1}, "video/mp4", Map.of());
        ObjectStore.StoredObject second = store.put("episodes/e1/final.mp4", new byte[]{2, 3}, "video/mp4", Map.of("kind", "final"));

        assertEquals("https://cdn.example.com/episodes/e1/final.mp4", second.url());
        assertArrayEquals(new byte[]{2, 3}, Files.readAllBytes(base.resolve("episodes/e1/final.mp4")));
        assertThat(Files.readString(base.resolve("episodes/e1/final.mp4.meta"))).contains("kind=final", "content-type=video/mp4");
        assertTrue(store.exists("episodes/e1/final.mp4"));
        assertFalse(store.exists("episodes/e1/tts.mp3"));
    }

    @Test
    void withoutBaseUrlReturnsFileUris() {
        LocalObjectStore store = new LocalObjectStore(base, null);

        assertThat(store.urlFor("episodes/e1/variant-1.mp4")).startsWith("file:");
    }

    @Test
    void keysCannotEscapeTheBaseDirectory() {
        LocalObjectStore store = new LocalObjectStore(base, null);

        assertThrows(StorageException.class, () -> store.put("../outside.mp4", new byte[]{1}, "video/mp4", Map.of()));
        assertThrows(StorageException.class, () -> store.exists(" "));
    }
}
