package com.example.series_backend.util;

import java.util.Locale;

public final class AudioExtensions {

    private AudioExtensions() {
    }

    /**
     * Maps an audio content type to the file extension used for stored narration tracks.
     */
    public static String forContentType(String contentType) {
        String ct = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("wav")) return "wav";
        if (ct.contains("mp4") || ct.contains("m4a") || ct.contains("aac")) return "m4a";
        return "mp3";
    }
}
