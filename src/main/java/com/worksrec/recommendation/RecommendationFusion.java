package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.FusionWeights;
import com.worksrec.domain.DomainModels.ScoredItem;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class RecommendationFusion {

    public List<ScoredItem> combine(List<ScoredItem> contentRanked, List<ScoredItem> collabRanked) {
        return combine(contentRanked, collabRanked, FusionWeights.DEFAULT);
    }

    public List<ScoredItem> combine(List<ScoredItem> contentRanked, List<ScoredItem> collabRanked, FusionWeights weights) {
        return combine(contentRanked, collabRanked, weights.contentWeight(), weights.collabWeight());
    }

    // A work missing from one list contributes 0 from that side.
    public List<ScoredItem> combine(List<ScoredItem> contentRanked, List<ScoredItem> collabRanked,
                                    double contentWeight, double collabWeight) {
        Map<String, Double> combined = new LinkedHashMap<>();
        for (ScoredItem item : contentRanked) {
            combined.merge(item.workId(), contentWeight * item.score(), Double::sum);
        }
        for (ScoredItem item : collabRanked) {
            combined.merge(item.workId(), collabWeight * item.score(), Double::sum);
        }
        return Rankings.sortedDescending(combined);
    }
}
