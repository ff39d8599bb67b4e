package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.ScoredItem;

import java.util.List;

public class RecommendationModels {
    public record RecommendationResult(List<ScoredItem> recommendations,
                                       int contentCandidates,
                                       int collaborativeCandidates,
                                       int fusedCandidates,
                                       SamplingPolicy samplingPolicy,
                                       Long seed) {}
}
