package com.adlanda.mediphant.repository;

import com.adlanda.mediphant.exception.UpstreamServiceException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Pinecone-backed vector index, talking to the REST data plane.
 *
 * The data-plane host is taken from configuration, or resolved once from the
 * control plane on first use.
 */
public class PineconeVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PineconeVectorIndex.class);

    static final String API_KEY_HEADER = "Api-Key";
    static final String API_VERSION_HEADER = "X-Pinecone-API-Version";
    static final String API_VERSION = "2025-01";
    static final String TEXT_METADATA_KEY = "text";

    private final RestClient controlPlane;
    private final RestClient.Builder restClientBuilder;
    private final String apiKey;
    private final String indexName;

    private volatile RestClient dataPlane;

    /**
     * @param restClientBuilder Builder carrying the timeout-bounded request factory
     * @param apiKey            Pinecone API key
     * @param indexName         Index to operate on
     * @param indexHost         Data-plane host, blank to resolve it lazily
     * @param controlPlaneUrl   Base URL of the control plane
     */
    public PineconeVectorIndex(RestClient.Builder restClientBuilder, String apiKey, String indexName,
                               String indexHost, String controlPlaneUrl) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("Pinecone API key is required");
        }
        this.restClientBuilder = restClientBuilder.clone();
        this.apiKey = apiKey;
        this.indexName = indexName;
        this.controlPlane = authorized(controlPlaneUrl);
        if (indexHost != null && !indexHost.isBlank()) {
            this.dataPlane = authorized(toBaseUrl(indexHost));
        }
    }

    @Override
    public List<VectorNeighbor> query(float[] vector, int topK) {
        QueryResponse response = post("/query", new QueryRequest(vector, topK, true), QueryResponse.class);
        if (response == null || response.matches() == null) {
            return List.of();
        }
        return response.matches().stream()
                .map(PineconeVectorIndex::toNeighbor)
                .toList();
    }

    @Override
    public int upsert(List<IndexedVector> vectors) {
        if (vectors.isEmpty()) {
            return 0;
        }
        List<UpsertVector> body = vectors.stream()
                .map(v -> new UpsertVector(v.id(), v.values(), v.metadata()))
                .toList();
        UpsertResponse response = post("/vectors/upsert", new UpsertRequest(body), UpsertResponse.class);
        int upserted = response == null ? 0 : response.upsertedCount();
        log.debug("Upserted {} vectors into index '{}'", upserted, indexName);
        return upserted;
    }

    @Override
    public IndexStats describe() {
        StatsResponse response = post("/describe_index_stats", Map.of(), StatsResponse.class);
        if (response == null) {
            throw new UpstreamServiceException("Empty stats response from index '" + indexName + "'");
        }
        return new IndexStats(response.dimension(), response.totalVectorCount());
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        try {
            return dataPlane().post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(responseType);
        } catch (RestClientException e) {
            throw new UpstreamServiceException("Vector index call " + path + " failed", e);
        }
    }

    private RestClient dataPlane() {
        RestClient client = dataPlane;
        if (client == null) {
            synchronized (this) {
                if (dataPlane == null) {
                    dataPlane = authorized(toBaseUrl(resolveHost()));
                }
                client = dataPlane;
            }
        }
        return client;
    }

    private String resolveHost() {
        IndexDescription description;
        try {
            description = controlPlane.get()
                    .uri("/indexes/{name}", indexName)
                    .retrieve()
                    .body(IndexDescription.class);
        } catch (RestClientException e) {
            throw new UpstreamServiceException("Could not resolve host of index '" + indexName + "'", e);
        }
        if (description == null || description.host() == null || description.host().isBlank()) {
            throw new UpstreamServiceException("Index '" + indexName + "' has no host");
        }
        log.info("Resolved host for index '{}'", indexName);
        return description.host();
    }

    private RestClient authorized(String baseUrl) {
        return restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(API_KEY_HEADER, apiKey)
                .defaultHeader(API_VERSION_HEADER, API_VERSION)
                .build();
    }

    private static String toBaseUrl(String host) {
        return host.startsWith("http://") || host.startsWith("https://") ? host : "https://" + host;
    }

    private static VectorNeighbor toNeighbor(QueryMatch match) {
        Object text = match.metadata() == null ? null : match.metadata().get(TEXT_METADATA_KEY);
        return new VectorNeighbor(match.id(), match.score(), text instanceof String s ? s : "");
    }

    record QueryRequest(float[] vector, int topK, boolean includeMetadata) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryResponse(List<QueryMatch> matches) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryMatch(String id, double score, Map<String, Object> metadata) {}

    record UpsertRequest(List<UpsertVector> vectors) {}

    record UpsertVector(String id, float[] values, Map<String, Object> metadata) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpsertResponse(int upsertedCount) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatsResponse(int dimension, long totalVectorCount) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexDescription(String name, String host) {}
}
