package ch.so.arp.explorer.search;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File backed cache of item embeddings. The cache file is only trusted when it
 * is at least as recent as the catalog feed it was computed from. Misses are
 * collected in memory and written in one batch by {@link #flush()}.
 * <p>
 * File layout: magic, format version, entry count, then for each entry the
 * item id, the vector dimension and the vector components, all big endian.
 */
class EmbeddingCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingCache.class);

    static final int MAGIC = 0x45434348;
    static final int FORMAT_VERSION = 1;

    // magic, version and count
    private static final int HEADER_BYTES = 3 * Integer.BYTES;
    // item id and dimension
    private static final int ENTRY_HEADER_BYTES = 2 * Integer.BYTES;

    private final Path cachePath;
    private final Map<Integer, float[]> embeddings;
    private int computedCount;

    EmbeddingCache(Path cachePath, Map<Integer, float[]> embeddings) {
        this.cachePath = Objects.requireNonNull(cachePath, "cachePath");
        this.embeddings = new HashMap<>(Objects.requireNonNull(embeddings, "embeddings"));
    }

    /**
     * Open the cache for the given feed. A stale, missing or unreadable cache
     * file yields an empty working set.
     */
    static EmbeddingCache open(Path cachePath, Path sourcePath) {
        if (!isValid(cachePath, sourcePath)) {
            LOGGER.info("No valid embedding cache at {}, embeddings will be recomputed", cachePath);
            return new EmbeddingCache(cachePath, Map.of());
        }
        Map<Integer, float[]> loaded = load(cachePath).orElse(Map.of());
        LOGGER.info("Loaded {} cached embeddings from {}", loaded.size(), cachePath);
        return new EmbeddingCache(cachePath, loaded);
    }

    static boolean isValid(Path cachePath, Path sourcePath) {
        try {
            if (!Files.isRegularFile(cachePath)) {
                return false;
            }
            FileTime cacheTime = Files.getLastModifiedTime(cachePath);
            FileTime sourceTime = Files.getLastModifiedTime(sourcePath);
            return cacheTime.compareTo(sourceTime) >= 0;
        } catch (IOException | SecurityException ex) {
            LOGGER.warn("Unable to compare {} with {}: {}", cachePath, sourcePath, ex.getMessage());
            return false;
        }
    }

    static Optional<Map<Integer, float[]>> load(Path cachePath) {
        if (!Files.isRegularFile(cachePath)) {
            return Optional.empty();
        }
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(cachePath)))) {
            long remaining = Files.size(cachePath) - HEADER_BYTES;
            if (in.readInt() != MAGIC) {
                throw new IOException("not an embedding cache file");
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("unsupported format version " + version);
            }
            int count = in.readInt();
            if (count < 0 || count > remaining / ENTRY_HEADER_BYTES) {
                throw new IOException("implausible entry count " + count);
            }
            Map<Integer, float[]> embeddings = new HashMap<>();
            for (int i = 0; i < count; i++) {
                int id = in.readInt();
                int dimension = in.readInt();
                remaining -= ENTRY_HEADER_BYTES;
                if (dimension < 0 || dimension > remaining / Float.BYTES) {
                    throw new IOException("implausible dimension " + dimension + " for item " + id);
                }
                remaining -= (long) dimension * Float.BYTES;
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = in.readFloat();
                }
                embeddings.put(id, vector);
            }
            return Optional.of(embeddings);
        } catch (IOException ex) {
            LOGGER.warn("Failed to load embedding cache {}: {}", cachePath, ex.getMessage());
            return Optional.empty();
        }
    }

    static void save(Map<Integer, float[]> embeddings, Path cachePath) {
        Path tempFile = null;
        try {
            Path directory = cachePath.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            tempFile = Files.createTempFile(directory, cachePath.getFileName().toString(), ".tmp");
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tempFile)))) {
                out.writeInt(MAGIC);
                out.writeInt(FORMAT_VERSION);
                out.writeInt(embeddings.size());
                for (Map.Entry<Integer, float[]> entry : embeddings.entrySet()) {
                    out.writeInt(entry.getKey());
                    out.writeInt(entry.getValue().length);
                    for (float value : entry.getValue()) {
                        out.writeFloat(value);
                    }
                }
            }
            Files.move(tempFile, cachePath, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Saved {} embeddings to {}", embeddings.size(), cachePath);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to save embedding cache {}: {}", cachePath, ex.getMessage(), ex);
            deleteQuietly(tempFile);
        }
    }

    /**
     * Return the cached embedding of the item or compute and remember it. The
     * supplier's exceptions propagate and nothing is cached for the item.
     */
    float[] getOrCompute(int itemId, Supplier<float[]> compute) {
        float[] cached = embeddings.get(itemId);
        if (cached != null) {
            return cached;
        }
        float[] computed = compute.get();
        if (computed == null) {
            throw new EmbeddingException("No embedding computed for item " + itemId);
        }
        embeddings.put(itemId, computed);
        computedCount++;
        return computed;
    }

    /**
     * Persist the working set if anything was computed since the cache was
     * opened.
     */
    void flush() {
        if (computedCount == 0) {
            LOGGER.debug("Embedding cache {} is up to date", cachePath);
            return;
        }
        save(embeddings, cachePath);
        computedCount = 0;
    }

    int size() {
        return embeddings.size();
    }

    int computedCount() {
        return computedCount;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            LOGGER.debug("Could not delete temporary cache file {}", file, ex);
        }
    }
}
