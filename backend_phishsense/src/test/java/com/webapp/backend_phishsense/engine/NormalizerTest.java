package com.webapp.backend_phishsense.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizerTest {

    @Test
    void joinsWithSpaceAndLowerCases() {
        assertThat(Normalizer.normalize("Verify NOW", "HTTP://Bit.ly/X")).isEqualTo("verify now http://bit.ly/x");
    }

    @Test
    void emptyInputsGiveSeparatorOnly() {
        assertThat(Normalizer.normalize("", "")).isEqualTo(" ");
    }

    @Test
    void nullsAreEmpty() {
        assertThat(Normalizer.normalize(null, null)).isEqualTo(" ");
        assertThat(Normalizer.normalize("Hi", null)).isEqualTo("hi ");
    }
}
