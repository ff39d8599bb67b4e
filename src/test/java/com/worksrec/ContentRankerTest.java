package com.worksrec;

import com.worksrec.domain.DomainModels.MetricsConfig;
import com.worksrec.domain.DomainModels.ScoredItem;
import com.worksrec.domain.DomainModels.Tag;
import com.worksrec.domain.DomainModels.UserProfile;
import com.worksrec.domain.DomainModels.Work;
import com.worksrec.recommendation.ContentRanker;
import com.worksrec.recommendation.ContentScorer;
import com.worksrec.recommendation.TagSimilarity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentRankerTest {
    private final ContentScorer scorer = new ContentScorer(new TagSimilarity());
    private final ContentRanker ranker = new ContentRanker(scorer);
    private final UserProfile scifiFan = new UserProfile(List.of(new Tag("scifi", 1.0)));

    @Test
    void ranksTagMatchesAboveOthersWithMetricsDisabled() {
        List<Work> catalog = List.of(
                new Work("B", List.of(new Tag("drama", 1.0)), 0, 0),
                new Work("A", List.of(new Tag("scifi", 1.0)), 10, 5));

        List<ScoredItem> ranked = ranker.rank(scifiFan, catalog, MetricsConfig.TAGS_ONLY);

        assertEquals(List.of(new ScoredItem("A", 1.0), new ScoredItem("B", 0.0)), ranked);
    }

    @Test
    void metricsAreNormalizedAgainstCatalogMaxima() {
        MetricsConfig config = new MetricsConfig(true, 0.5, 0.25, 1.0);
        List<Work> catalog = List.of(
                new Work("popular", List.of(new Tag("drama", 1.0)), 200, 40),
                new Work("niche", List.of(new Tag("scifi", 1.0)), 50, 10));

        List<ScoredItem> ranked = ranker.rank(scifiFan, catalog, config);

        assertEquals("niche", ranked.get(0).workId());
        assertEquals(1.0 + 0.5 * 0.25 + 0.25 * 0.25, ranked.get(0).score(), 1e-12);
        assertEquals(0.5 + 0.25, ranked.get(1).score(), 1e-12);
    }

    @Test
    void zeroMaximaContributeNothing() {
        MetricsConfig config = new MetricsConfig(true, 1.0, 1.0, 1.0);
        Work work = new Work("A", List.of(new Tag("scifi", 1.0)), 0, 0);

        assertEquals(1.0, scorer.score(scifiFan, work, config, 0, 0), 1e-12);
        assertEquals(1.0, scorer.score(scifiFan, work, config, -3, -1), 1e-12);
    }

    @Test
    void metricsIgnoredWhenDisabledEvenWithWeights() {
        MetricsConfig config = new MetricsConfig(false, 5.0, 5.0, 2.0);
        Work work = new Work("A", List.of(new Tag("scifi", 1.0)), 10, 10);
        assertEquals(2.0, scorer.score(scifiFan, work, config, 10, 10), 1e-12);
    }

    @Test
    void keepsEveryWorkSortedAndTiesInCatalogOrder() {
        List<Work> catalog = List.of(
                new Work("x", List.of(), 0, 0),
                new Work("y", List.of(new Tag("scifi", 2.0)), 0, 0),
                new Work("z", List.of(), 0, 0),
                new Work("w", List.of(new Tag("drama", 1.0)), 0, 0));

        List<ScoredItem> ranked = ranker.rank(scifiFan, catalog, new MetricsConfig(false, 0, 0, -1.0));

        assertEquals(catalog.size(), ranked.size());
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score());
        }
        assertEquals(List.of("x", "z", "w", "y"), ranked.stream().map(ScoredItem::workId).toList());
    }

    @Test
    void emptyCatalogGivesEmptyRanking() {
        assertTrue(ranker.rank(scifiFan, List.of(), MetricsConfig.TAGS_ONLY).isEmpty());
    }
}
