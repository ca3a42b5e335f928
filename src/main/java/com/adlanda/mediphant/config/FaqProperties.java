package com.adlanda.mediphant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the FAQ service.
 *
 * Maps to properties prefixed with 'faq' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "faq")
public class FaqProperties {

    private final Corpus corpus = new Corpus();
    private final OpenAi openai = new OpenAi();
    private final Pinecone pinecone = new Pinecone();
    private final External external = new External();
    private final RateLimit rateLimit = new RateLimit();
    private final History history = new History();

    public Corpus getCorpus() {
        return corpus;
    }

    public OpenAi getOpenai() {
        return openai;
    }

    public Pinecone getPinecone() {
        return pinecone;
    }

    public External getExternal() {
        return external;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public History getHistory() {
        return history;
    }

    public static class Corpus {

        /**
         * Spring resource location of the corpus document.
         */
        private String location = "classpath:corpus.md";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class OpenAi {

        /**
         * API key used for embeddings and answer generation.
         * When empty, the service starts in fallback-only mode.
         */
        private String apiKey = "";

        private String embeddingModel = "text-embedding-ada-002";

        private String chatModel = "gpt-3.5-turbo";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getEmbeddingModel() {
            return embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }

        public String getChatModel() {
            return chatModel;
        }

        public void setChatModel(String chatModel) {
            this.chatModel = chatModel;
        }
    }

    public static class Pinecone {

        /**
         * API key of the vector backend.
         * When empty, the service starts in fallback-only mode.
         */
        private String apiKey = "";

        /**
         * Name of the index holding the corpus vectors.
         */
        private String index = "mediphant-test";

        /**
         * Data-plane host of the index. Looked up from the control plane when empty.
         */
        private String indexHost = "";

        private String controlPlaneUrl = "https://api.pinecone.io";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getIndex() {
            return index;
        }

        public void setIndex(String index) {
            this.index = index;
        }

        public String getIndexHost() {
            return indexHost;
        }

        public void setIndexHost(String indexHost) {
            this.indexHost = indexHost;
        }

        public String getControlPlaneUrl() {
            return controlPlaneUrl;
        }

        public void setControlPlaneUrl(String controlPlaneUrl) {
            this.controlPlaneUrl = controlPlaneUrl;
        }
    }

    public static class External {

        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound for waiting on any embedding, vector or generation response.
         */
        private Duration readTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class RateLimit {

        private Duration window = Duration.ofSeconds(60);

        /**
         * Requests admitted per client and window.
         */
        private int capacity = 100;

        private long sweepIntervalMs = 300_000;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class History {

        private int capacity = 10;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }
}
