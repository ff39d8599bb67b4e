package com.worksrec.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksrec.domain.DomainModels.ScoredItem;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RecommendationJsonWriter {
    private final ObjectMapper objectMapper;

    public RecommendationJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(List<ScoredItem> recommendations) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(recommendations));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize recommendations", e);
        }
    }

    public static RecommendationDocument toDocument(List<ScoredItem> recommendations) {
        return new RecommendationDocument(recommendations.stream()
                .map(item -> new RecommendationEntry(item.workId(), item.score()))
                .toList());
    }

    public record RecommendationDocument(List<RecommendationEntry> recommendations) {}

    public record RecommendationEntry(String id, double score) {}
}
