package com.adlanda.mediphant.config;

import com.adlanda.mediphant.model.CredentialStatus;
import com.adlanda.mediphant.model.ExternalServicesSettings;
import com.adlanda.mediphant.repository.PineconeVectorIndex;
import com.adlanda.mediphant.repository.VectorIndex;
import com.adlanda.mediphant.service.EmbeddingService;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds the clients for the external embedding, vector and generation services.
 *
 * All clients share connect and read timeouts from configuration and never retry
 * inline: a failed call is reported to the caller at once.
 */
@Component
public class ExternalClientFactory {

    private static final int ANSWER_MAX_TOKENS = 200;
    private static final double ANSWER_TEMPERATURE = 0.3;

    private final FaqProperties properties;
    private final RestClient.Builder restClientBuilder;

    public ExternalClientFactory(FaqProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;
        this.restClientBuilder = restClientBuilder.clone().requestFactory(requestFactory(properties.getExternal()));
    }

    /**
     * Which credentials are configured.
     */
    public ExternalServicesSettings settings() {
        return new ExternalServicesSettings(
                CredentialStatus.of(properties.getOpenai().getApiKey()),
                CredentialStatus.of(properties.getPinecone().getApiKey()));
    }

    public EmbeddingService createEmbeddingService() {
        FaqProperties.OpenAi openai = properties.getOpenai();
        OpenAiEmbeddingModel model = new OpenAiEmbeddingModel(
                openAiApi(),
                MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(openai.getEmbeddingModel()).build(),
                singleAttempt());
        return new EmbeddingService(model);
    }

    public VectorIndex createVectorIndex() {
        FaqProperties.Pinecone pinecone = properties.getPinecone();
        return new PineconeVectorIndex(
                restClientBuilder,
                pinecone.getApiKey(),
                pinecone.getIndex(),
                pinecone.getIndexHost(),
                pinecone.getControlPlaneUrl());
    }

    public ChatModel createChatModel() {
        FaqProperties.OpenAi openai = properties.getOpenai();
        return OpenAiChatModel.builder()
                .openAiApi(openAiApi())
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(openai.getChatModel())
                        .maxTokens(ANSWER_MAX_TOKENS)
                        .temperature(ANSWER_TEMPERATURE)
                        .build())
                .retryTemplate(singleAttempt())
                .build();
    }

    private OpenAiApi openAiApi() {
        String apiKey = properties.getOpenai().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("OpenAI API key is not configured");
        }
        return OpenAiApi.builder()
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder.clone())
                .build();
    }

    private static RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(FaqProperties.External external) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(external.getConnectTimeout());
        factory.setReadTimeout(external.getReadTimeout());
        return factory;
    }
}
