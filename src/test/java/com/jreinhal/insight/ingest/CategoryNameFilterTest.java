package com.jreinhal.insight.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CategoryNameFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {"Buy a Kindle", "amazon.co.uk", "Mazon.co.uk", "TV", "123", "walmart.com", "  ", "4.5"})
    @DisplayName("Marketplace noise is rejected")
    void rejectsNoise(String category) {
        assertThat(CategoryNameFilter.isValid(category)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Electronics", "Home Audio", "iPod", "Tablets & E-Readers", "Fire Tablets 7 in."})
    @DisplayName("Real categories pass")
    void acceptsCategories(String category) {
        assertThat(CategoryNameFilter.isValid(category)).isTrue();
    }

    @Test
    @DisplayName("Extraction trims, filters and deduplicates in order")
    void extract() {
        assertThat(CategoryNameFilter.extract("Electronics, Amazon.co.uk,TV , Home Audio,Electronics,Buy a Kindle"))
                .containsExactly("Electronics", "Home Audio");
        assertThat(CategoryNameFilter.extract(null)).isEmpty();
    }
}
