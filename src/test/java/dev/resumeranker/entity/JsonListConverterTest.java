package dev.resumeranker.entity;

import dev.resumeranker.model.DuplicateCriterion;
import dev.resumeranker.model.PairSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonListConverterTest {

    @Test
    @DisplayName("Should store string lists as JSON arrays")
    void shouldStoreStringList() {
        StringListConverter converter = new StringListConverter();

        assertThat(converter.convertToDatabaseColumn(List.of("Matches skill: java")))
                .isEqualTo("[\"Matches skill: java\"]");
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
    }

    @Test
    @DisplayName("Should read pair similarity records back from JSON")
    void shouldReadPairs() {
        PairSimilarityListConverter converter = new PairSimilarityListConverter();
        PairSimilarity pair = new PairSimilarity("a", "b", 0.9, 0.0, 0.5, 0.8, 0.9, DuplicateCriterion.BLEND);

        List<PairSimilarity> read = converter.convertToEntityAttribute(converter.convertToDatabaseColumn(List.of(pair)));

        assertThat(read).containsExactly(pair);
    }

    @Test
    @DisplayName("Should treat empty columns as empty lists")
    void shouldReadEmptyColumn() {
        assertThat(new StringListConverter().convertToEntityAttribute(null)).isEmpty();
        assertThat(new StringListConverter().convertToEntityAttribute("  ")).isEmpty();
    }

    @Test
    @DisplayName("Should reject corrupt column data")
    void shouldRejectCorruptData() {
        assertThatThrownBy(() -> new StringListConverter().convertToEntityAttribute("not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
