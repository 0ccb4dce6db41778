package ch.so.arp.explorer.search;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder embeddings for running without a model server. Every input is
 * hashed into the seed of a Gaussian vector, so equal inputs always land on the
 * same point of the unit sphere. Image URLs are hashed in their own namespace
 * and never downloaded.
 */
class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private static final String TEXT_NAMESPACE = "text:";
    private static final String IMAGE_NAMESPACE = "image:";

    private final int dimensions;

    DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Embedding dimensions must be at least 1, got " + dimensions);
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic {}-dimensional embeddings", dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        return pointFor(TEXT_NAMESPACE + text.strip());
    }

    @Override
    public float[] embedImage(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new EmbeddingException("Cannot embed an image without URL");
        }
        return pointFor(IMAGE_NAMESPACE + imageUrl);
    }

    private float[] pointFor(String key) {
        Random random = new Random(seedOf(key));
        float[] raw = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            raw[i] = (float) random.nextGaussian();
        }
        double[] unit = Vectors.normalize(raw);
        if (unit == null) {
            // all components zero, practically unreachable
            raw[0] = 1.0f;
            return raw;
        }
        float[] embedding = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            embedding[i] = (float) unit[i];
        }
        return embedding;
    }

    private static long seedOf(String key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
