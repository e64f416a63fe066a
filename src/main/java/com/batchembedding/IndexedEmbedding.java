package com.batchembedding;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One embedding vector paired with the position of its input in the batch that produced it.
 */
public final class IndexedEmbedding {

    private final int index;
    private final List<Float> vector;

    public IndexedEmbedding(int index, List<Float> vector) {
        this.index = index;
        this.vector = Collections.unmodifiableList(Objects.requireNonNull(vector, "vector"));
    }

    public int getIndex() {
        return index;
    }

    public List<Float> getVector() {
        return vector;
    }

    public IndexedEmbedding withIndex(int newIndex) {
        return new IndexedEmbedding(newIndex, vector);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexedEmbedding)) {
            return false;
        }
        IndexedEmbedding that = (IndexedEmbedding) o;
        return index == that.index && vector.equals(that.vector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, vector);
    }

    @Override
    public String toString() {
        return "IndexedEmbedding{index=" + index + ", dimensions=" + vector.size() + "}";
    }
}
