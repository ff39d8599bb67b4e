package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.MetricsConfig;
import com.worksrec.domain.DomainModels.UserProfile;
import com.worksrec.domain.DomainModels.Work;
import org.springframework.stereotype.Component;

@Component
public class ContentScorer {
    private final TagSimilarity similarity;

    public ContentScorer(TagSimilarity similarity) {
        this.similarity = similarity;
    }

    // maxViews and maxTime are the catalog maxima.
    public double score(UserProfile user, Work work, MetricsConfig config, double maxViews, double maxTime) {
        double score = config.weightTags() * similarity.similarity(user, work);
        if (config.useMetrics()) {
            double normViews = maxViews > 0 ? work.viewCount() / maxViews : 0.0;
            double normTime = maxTime > 0 ? work.interactionTime() / maxTime : 0.0;
            score += config.weightViews() * normViews + config.weightTime() * normTime;
        }
        return score;
    }
}
