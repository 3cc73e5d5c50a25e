package dev.resumeranker.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.resumeranker.model.PairSimilarity;
import jakarta.persistence.Converter;

@Converter
public class PairSimilarityListConverter extends JsonListConverter<PairSimilarity> {

    public PairSimilarityListConverter() {
        super(new TypeReference<>() {
        });
    }
}
