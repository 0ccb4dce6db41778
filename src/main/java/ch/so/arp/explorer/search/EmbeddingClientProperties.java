package ch.so.arp.explorer.search;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties describing which embedding model is used and how to
 * reach it.
 */
@ConfigurationProperties(prefix = "explorer.embedding")
public class EmbeddingClientProperties {

    /**
     * Whether deterministic placeholder embeddings are used instead of a model
     * server.
     */
    private boolean mock = true;

    /**
     * Dimension of the deterministic embeddings.
     */
    private int dimensions = 512;

    /**
     * Base URL of the embedding model server.
     */
    private String baseUrl;

    /**
     * Name of the model the server should use.
     */
    private String model = "openai/clip-vit-base-patch32";

    /**
     * Optional bearer token sent to the model server.
     */
    private String apiKey;

    public boolean isMock() {
        return mock;
    }

    public void setMock(boolean mock) {
        this.mock = mock;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }
}
