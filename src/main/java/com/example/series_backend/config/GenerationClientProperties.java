package com.example.series_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints of the remote generation services. A client is only wired when its
 * {@code enabled} flag is set and a base URL is present.
 */
@ConfigurationProperties(prefix = "generation")
public class GenerationClientProperties {

    private Video video = new Video();
    private Gradient gradient = new Gradient();

    public Video getVideo() { return video; }
    public void setVideo(Video video) { this.video = video; }

    public Gradient getGradient() { return gradient; }
    public void setGradient(Gradient gradient) { this.gradient = gradient; }

    public static class Video {
        private boolean enabled = false;
        private String baseUrl;
        private String path = "/generate";
        private int timeoutSeconds = 600;
        private String negativePrompt = "low quality, worst quality, deformed, distorted";
        private int numFrames = 121;
        private int fps = 24;
        private int inferenceSteps = 50;
        private double guidanceScale = 7.5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public String getNegativePrompt() { return negativePrompt; }
        public void setNegativePrompt(String negativePrompt) { this.negativePrompt = negativePrompt; }

        public int getNumFrames() { return numFrames; }
        public void setNumFrames(int numFrames) { this.numFrames = numFrames; }

        public int getFps() { return fps; }
        public void setFps(int fps) { this.fps = fps; }

        public int getInferenceSteps() { return inferenceSteps; }
        public void setInferenceSteps(int inferenceSteps) { this.inferenceSteps = inferenceSteps; }

        public double getGuidanceScale() { return guidanceScale; }
        public void setGuidanceScale(double guidanceScale) { this.guidanceScale = guidanceScale; }
    }

    public static class Gradient {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey = "";
        private String model = "llama3.3-70b-instruct";
        private String ttsVoice = "narrator";
        private int timeoutSeconds = 60;
        private long pollIntervalMs = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getTtsVoice() { return ttsVoice; }
        public void setTtsVoice(String ttsVoice) { this.ttsVoice = ttsVoice; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }
}
