package com.deepansh.recall.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyNormalizerTest {

    KeyNormalizer normalizer = new KeyNormalizer();

    @Test
    void normalize_aliasesMapToCanonicalKey() {
        assertThat(normalizer.normalize("full_name")).isEqualTo("name");
        assertThat(normalizer.normalize("City")).isEqualTo("location");
        assertThat(normalizer.normalize(" db ")).isEqualTo("database");
        assertThat(normalizer.normalize("max line length")).isEqualTo("line_length");
    }

    @Test
    void normalize_unknownKey_passesThroughLowerCased() {
        assertThat(normalizer.normalize("Favourite_Editor")).isEqualTo("favourite_editor");
    }

    @Test
    void normalize_canonicalKeyIsStable() {
        assertThat(normalizer.normalize("timezone")).isEqualTo("timezone");
    }
}
