package org.seleznyov.iyu.tracepipe.shared.utils;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilsTest {

    @Test
    void shouldBeDeterministic() {
        byte[] content = "{\"op\":\"get\",\"key\":42}".getBytes(StandardCharsets.UTF_8);

        assertThat(HashUtils.hash64(content)).isEqualTo(HashUtils.hash64(content.clone()));
    }

    @Test
    void shouldDistinguishSimilarContent() {
        long first = HashUtils.hash64("ping".getBytes(StandardCharsets.UTF_8));
        long second = HashUtils.hash64("pong".getBytes(StandardCharsets.UTF_8));

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void nullShouldHashToZero() {
        assertThat(HashUtils.hash64(null)).isZero();
    }

    @Test
    void emptyInputShouldStillBeMixed() {
        assertThat(HashUtils.hash64(new byte[0])).isNotZero();
    }

    @Test
    void fmixShouldKeepZeroAndSpreadSingleBits() {
        assertThat(HashUtils.fmix64(0L)).isZero();
        assertThat(Long.bitCount(HashUtils.fmix64(1L) ^ HashUtils.fmix64(2L))).isGreaterThan(16);
    }
}
