package com.deepansh.recall.episode;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void cosineDistance_sameDirection_isZero() {
        assertThat(VectorMath.cosineDistance(new float[]{2f, 0f}, List.of(1.0, 0.0))).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void cosineDistance_orthogonal_isOne() {
        assertThat(VectorMath.cosineDistance(new float[]{1f, 0f}, List.of(0.0, 3.0))).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void cosineDistance_opposite_isTwo() {
        assertThat(VectorMath.cosineDistance(new float[]{1f, 0f}, List.of(-1.0, 0.0))).isCloseTo(2.0, within(1e-6));
    }

    @Test
    void cosineDistance_mismatchedOrZeroVectors_treatedAsUnrelated() {
        assertThat(VectorMath.cosineDistance(new float[]{1f, 0f}, List.of(1.0, 0.0, 0.0))).isEqualTo(1.0);
        assertThat(VectorMath.cosineDistance(new float[]{0f, 0f}, List.of(1.0, 0.0))).isEqualTo(1.0);
        assertThat(VectorMath.cosineDistance(new float[]{1f, 0f}, null)).isEqualTo(1.0);
    }
}
