package ch.so.arp.explorer.search;

/**
 * Maps query text and catalog images into one shared vector space, so a text
 * vector can be compared with an image vector by cosine similarity.
 */
public interface EmbeddingProvider {

    /**
     * Embed a search query.
     *
     * @param text non-blank query text
     * @return the query vector
     * @throws EmbeddingException if no vector could be produced
     */
    float[] embed(String text);

    /**
     * Embed the image published at the given location.
     *
     * @param imageUrl location of the image
     * @return the image vector
     * @throws EmbeddingException if the image could not be fetched or encoded
     */
    float[] embedImage(String imageUrl);
}
