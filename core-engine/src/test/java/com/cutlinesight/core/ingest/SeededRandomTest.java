package com.cutlinesight.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeededRandom}.
 */
class SeededRandomTest {

    @Test
    @DisplayName("Should hash with 32-bit FNV-1a")
    void shouldHashWithFnv1a() {
        assertThat(SeededRandom.hash("")).isEqualTo(0x811C9DC5);
        assertThat(Integer.toUnsignedLong(SeededRandom.hash("demo:events"))).isEqualTo(2385475645L);
        assertThat(Integer.toUnsignedLong(SeededRandom.hash("cutting-table.mp4:events"))).isEqualTo(2076581430L);
    }

    @Test
    @DisplayName("Hash should depend on character order")
    void hashShouldBeOrderDependent() {
        assertThat(SeededRandom.hash("ab")).isNotEqualTo(SeededRandom.hash("ba"));
    }

    @Test
    @DisplayName("Same seed should yield the same sequence")
    void shouldBeDeterministic() {
        SeededRandom a = SeededRandom.fromString("line-3");
        SeededRandom b = SeededRandom.fromString("line-3");

        for (int i = 0; i < 100; i++) {
            assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
        }
    }

    @Test
    @DisplayName("Values should lie in [0, 1)")
    void shouldStayInUnitInterval() {
        SeededRandom rng = new SeededRandom(-1);

        for (int i = 0; i < 10_000; i++) {
            assertThat(rng.nextDouble()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }
}
