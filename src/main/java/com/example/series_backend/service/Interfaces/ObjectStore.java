package com.example.series_backend.service.Interfaces;

import java.util.Map;

/**
 * Key/value blob store for generated media. Keys are deterministic so rewrites overwrite.
 */
public interface ObjectStore {

    StoredObject put(String key, byte[] bytes, String contentType, Map<String, String> metadata);

    boolean exists(String key);

    String urlFor(String key);

    record StoredObject(String key, String url) {}
}
