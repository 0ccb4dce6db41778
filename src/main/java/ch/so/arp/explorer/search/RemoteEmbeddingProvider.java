package ch.so.arp.explorer.search;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link EmbeddingProvider} backed by an HTTP model server that exposes the
 * text and image encoders of a CLIP model. Both endpoints answer with a JSON
 * object holding a single {@code embedding} array.
 */
class RemoteEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteEmbeddingProvider.class);

    static final String TEXT_PATH = "/embed/text";
    static final String IMAGE_PATH = "/embed/image";

    private final RestClient restClient;
    private final String model;

    RemoteEmbeddingProvider(RestClient.Builder builder, EmbeddingClientProperties properties) {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new IllegalArgumentException(
                    "Property 'explorer.embedding.base-url' must be provided when mocks are disabled");
        }
        builder.baseUrl(properties.getBaseUrl());
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        this.restClient = builder.build();
        this.model = properties.getModel();
        LOGGER.info("Using remote embeddings from {} with model {}", properties.getBaseUrl(), model);
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        return request(TEXT_PATH, Map.of("model", model, "text", text.strip()));
    }

    @Override
    public float[] embedImage(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new EmbeddingException("Cannot embed an image without URL");
        }
        return request(IMAGE_PATH, Map.of("model", model, "url", imageUrl));
    }

    private float[] request(String path, Map<String, String> body) {
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientException ex) {
            throw new EmbeddingException("Embedding request to " + path + " failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.embedding() == null || response.embedding().length == 0) {
            throw new EmbeddingException("Embedding server returned no vector for " + path);
        }
        LOGGER.debug("Received {}-dimensional embedding from {}", response.embedding().length, path);
        return response.embedding();
    }

    record EmbeddingResponse(float[] embedding) {
    }
}
