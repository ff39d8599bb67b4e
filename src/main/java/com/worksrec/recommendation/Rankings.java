package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.ScoredItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

final class Rankings {
    // List.sort is stable, so ties keep insertion order.
    static final Comparator<ScoredItem> BY_SCORE_DESC = Comparator.comparingDouble(ScoredItem::score).reversed();

    private Rankings() {
    }

    static List<ScoredItem> sortedDescending(Map<String, Double> scores) {
        List<ScoredItem> ranked = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> ranked.add(new ScoredItem(id, score)));
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }
}
