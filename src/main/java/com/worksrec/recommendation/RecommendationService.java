package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.FusionWeights;
import com.worksrec.domain.DomainModels.ScoredItem;
import com.worksrec.domain.DomainModels.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final ContentRanker contentRanker;
    private final CollaborativeRanker collaborativeRanker;
    private final RecommendationFusion fusion;
    private final DiversitySampler sampler;
    private final FusionWeights defaultWeights;
    private final SamplingPolicy samplingPolicy;

    public RecommendationService(ContentRanker contentRanker,
                                 CollaborativeRanker collaborativeRanker,
                                 RecommendationFusion fusion,
                                 DiversitySampler sampler) {
        this(contentRanker, collaborativeRanker, fusion, sampler, FusionWeights.DEFAULT, SamplingPolicy.TOP_SLICE);
    }

    @Autowired
    public RecommendationService(ContentRanker contentRanker,
                                 CollaborativeRanker collaborativeRanker,
                                 RecommendationFusion fusion,
                                 DiversitySampler sampler,
                                 @Value("${recommendation.fusion.content-weight:0.5}") double contentWeight,
                                 @Value("${recommendation.fusion.collab-weight:0.5}") double collabWeight,
                                 @Value("${recommendation.sampling.policy:TOP_SLICE}") SamplingPolicy samplingPolicy) {
        this(contentRanker, collaborativeRanker, fusion, sampler, new FusionWeights(contentWeight, collabWeight), samplingPolicy);
    }

    public RecommendationService(ContentRanker contentRanker,
                                 CollaborativeRanker collaborativeRanker,
                                 RecommendationFusion fusion,
                                 DiversitySampler sampler,
                                 FusionWeights defaultWeights,
                                 SamplingPolicy samplingPolicy) {
        this.contentRanker = contentRanker;
        this.collaborativeRanker = collaborativeRanker;
        this.fusion = fusion;
        this.sampler = sampler;
        this.defaultWeights = defaultWeights;
        this.samplingPolicy = samplingPolicy;
    }

    /**
     * Runs the whole scoring pass over one snapshot. A null {@code seed} seeds the sampler from
     * ambient entropy, so repeated calls may differ in which items are drawn and in their order.
     */
    public RecommendationModels.RecommendationResult recommend(Snapshot snapshot, Long seed) {
        List<ScoredItem> content = contentRanker.rank(snapshot.profile(), snapshot.catalog(), snapshot.metrics());
        List<ScoredItem> collaborative = collaborativeRanker.rank(snapshot.similarUsers());

        FusionWeights weights = snapshot.weights() == null ? defaultWeights : snapshot.weights();
        List<ScoredItem> fused = fusion.combine(content, collaborative, weights);
        log.debug("ranking stages content={} collaborative={} fused={} weights={}/{}",
                content.size(), collaborative.size(), fused.size(), weights.contentWeight(), weights.collabWeight());

        Random random = seed == null ? new Random() : new Random(seed);
        List<ScoredItem> picked = sampler.sample(fused,
                snapshot.params().numRecommendations(),
                snapshot.params().randomFactor(),
                samplingPolicy,
                random);

        log.info("recommendations computed requested={} returned={} random_factor={} policy={} seeded={}",
                snapshot.params().numRecommendations(), picked.size(), snapshot.params().randomFactor(),
                samplingPolicy, seed != null);

        return new RecommendationModels.RecommendationResult(picked, content.size(), collaborative.size(),
                fused.size(), samplingPolicy, seed);
    }
}
