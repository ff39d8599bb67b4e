package com.worksrec.service;

import com.worksrec.domain.DomainModels;
import com.worksrec.parser.ParserDtos;
import com.worksrec.parser.SnapshotParser;
import com.worksrec.recommendation.RecommendationModels;
import com.worksrec.recommendation.RecommendationService;
import com.worksrec.validation.SnapshotValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class SnapshotImportService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotImportService.class);

    private final SnapshotParser parser;
    private final SnapshotValidator validator;
    private final RecommendationService recommendationService;

    public SnapshotImportService(SnapshotParser parser,
                                 SnapshotValidator validator,
                                 RecommendationService recommendationService) {
        this.parser = parser;
        this.validator = validator;
        this.recommendationService = recommendationService;
    }

    public ImportResult importSnapshot(String content) {
        SnapshotParser.ParseResult parseResult = parser.parse(content == null ? "" : content);
        List<ParserDtos.ParseError> errors = new ArrayList<>(parseResult.errors());
        errors.addAll(validator.validate(parseResult.doc()));

        if (!errors.isEmpty()) {
            log.debug("snapshot rejected errors={}", errors.size());
            return new ImportResult(false, null, errors);
        }
        return new ImportResult(true, toDomain(parseResult.doc()), List.of());
    }

    public RecommendationModels.RecommendationResult recommend(String content, Long seed) {
        ImportResult result = importSnapshot(content);
        if (!result.valid()) {
            throw new SnapshotImportException(result.errors());
        }
        return recommendationService.recommend(result.snapshot(), seed);
    }

    private DomainModels.Snapshot toDomain(ParserDtos.SnapshotDoc doc) {
        DomainModels.UserProfile profile = new DomainModels.UserProfile(tags(doc.profile().tags()));

        List<DomainModels.Work> catalog = doc.works().stream()
                .map(w -> new DomainModels.Work(w.id(), tags(w.tags()), w.viewCount(), w.interactionTime()))
                .toList();

        List<DomainModels.SimilarUser> similarUsers = doc.similarUsers().stream()
                .map(u -> new DomainModels.SimilarUser(u.id(), u.similarity(), u.likedWorkIds()))
                .toList();

        ParserDtos.MetricsDoc m = doc.metrics();
        DomainModels.MetricsConfig metrics = new DomainModels.MetricsConfig(m.useMetrics(), m.weightViews(), m.weightTime(), m.weightTags());
        DomainModels.RecommendationParams params = new DomainModels.RecommendationParams(
                doc.params().numRecommendations(), doc.params().randomFactor());
        DomainModels.FusionWeights weights = doc.fusion() == null ? null
                : new DomainModels.FusionWeights(doc.fusion().contentWeight(), doc.fusion().collabWeight());

        return new DomainModels.Snapshot(profile, catalog, similarUsers, params, metrics, weights);
    }

    private List<DomainModels.Tag> tags(List<ParserDtos.TagDoc> docs) {
        return docs.stream().map(t -> new DomainModels.Tag(t.name(), t.value())).toList();
    }

    public record ImportResult(boolean valid,
                               DomainModels.Snapshot snapshot,
                               List<ParserDtos.ParseError> errors) {
    }
}
