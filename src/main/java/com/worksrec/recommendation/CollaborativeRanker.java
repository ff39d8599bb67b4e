package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.ScoredItem;
import com.worksrec.domain.DomainModels.SimilarUser;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CollaborativeRanker {

    // Works nobody liked are absent; ties keep first-liked order.
    public List<ScoredItem> rank(List<SimilarUser> similarUsers) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (SimilarUser user : similarUsers) {
            for (String workId : user.likedWorkIds()) {
                scores.merge(workId, user.similarity(), Double::sum);
            }
        }
        return Rankings.sortedDescending(scores);
    }
}
