package com.example.series_backend.engine.Interfaces;

public interface MediaFetcher {

    Download fetch(String url);

    record Download(byte[] bytes, String contentType) {}
}
