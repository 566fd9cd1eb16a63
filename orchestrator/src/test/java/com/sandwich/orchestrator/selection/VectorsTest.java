package com.sandwich.orchestrator.selection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorsTest {

    @Test
    void cosineSimilarity_identicalIsOne() {
        assertThat(Vectors.cosineSimilarity(new double[]{1, 2, 3}, new double[]{2, 4, 6}))
                .isCloseTo(1.0, within(1e-12));
    }

    @Test
    void cosineSimilarity_orthogonalIsZero() {
        assertThat(Vectors.cosineSimilarity(new double[]{1, 0}, new double[]{0, 1})).isEqualTo(0.0);
    }

    @Test
    void cosineSimilarity_oppositeIsMinusOne() {
        assertThat(Vectors.cosineSimilarity(new double[]{1, 1}, new double[]{-1, -1}))
                .isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void cosineSimilarity_zeroVectorIsZero() {
        assertThat(Vectors.cosineSimilarity(new double[]{0, 0}, new double[]{1, 1})).isEqualTo(0.0);
        assertThat(Vectors.cosineSimilarity(new double[]{}, new double[]{})).isEqualTo(0.0);
    }

    @Test
    void clamp01_boundsBothEnds() {
        assertThat(Vectors.clamp01(-0.2)).isEqualTo(0.0);
        assertThat(Vectors.clamp01(1.7)).isEqualTo(1.0);
        assertThat(Vectors.clamp01(0.4)).isEqualTo(0.4);
    }
}
