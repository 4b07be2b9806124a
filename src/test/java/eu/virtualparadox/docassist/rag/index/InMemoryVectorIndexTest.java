package eu.virtualparadox.docassist.rag.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryVectorIndexTest extends AbstractVectorIndexTest {

    @Override
    protected VectorIndex createIndex() {
        return new InMemoryVectorIndex();
    }

    @Test
    void zeroVectorScoresZero() {
        index.add(List.of(entry("zero", 0, 0), entry("one", 1, 0)));

        assertThat(index.search(new float[]{1, 0}, 2).hits().get(1).score()).isZero();
    }

    @Test
    void clearForgetsDimension() {
        index.add(List.of(entry("a", 1, 0, 0)));
        index.clear();
        index.add(List.of(entry("b", 1, 0)));

        assertThat(index.search(new float[]{1, 0}, 1).hits().get(0).chunk().chunkId()).isEqualTo("b");
    }
}
