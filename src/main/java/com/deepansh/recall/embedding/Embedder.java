package com.deepansh.recall.embedding;

/**
 * External embedding function. Vectors must share one dimension and be compared
 * with cosine distance; determinism for identical input is not assumed.
 */
public interface Embedder {

    float[] embed(String text);
}
