package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.MetricsConfig;
import com.worksrec.domain.DomainModels.ScoredItem;
import com.worksrec.domain.DomainModels.UserProfile;
import com.worksrec.domain.DomainModels.Work;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ContentRanker {
    private final ContentScorer scorer;

    public ContentRanker(ContentScorer scorer) {
        this.scorer = scorer;
    }

    public List<ScoredItem> rank(UserProfile user, List<Work> catalog, MetricsConfig config) {
        double maxViews = 0.0;
        double maxTime = 0.0;
        for (Work work : catalog) {
            if (work.viewCount() > maxViews) maxViews = work.viewCount();
            if (work.interactionTime() > maxTime) maxTime = work.interactionTime();
        }

        List<ScoredItem> ranked = new ArrayList<>(catalog.size());
        for (Work work : catalog) {
            ranked.add(new ScoredItem(work.id(), scorer.score(user, work, config, maxViews, maxTime)));
        }
        ranked.sort(Rankings.BY_SCORE_DESC);
        return ranked;
    }
}
